package ca.gc.cra.kafkarecon.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"config=cluster.json", "policy=p.yaml"});
    assertEquals("cluster.json", map.get("config"));
    assertEquals("p.yaml", map.get("policy"));
  }

  @Test
  void valueMayContainEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=env=lab,team=red"});
    assertEquals("env=lab,team=red", map.get("otelResourceAttributes"));
  }

  @Test
  void laterDuplicatesWin() {
    assertEquals("b", CliArgsParser.toMap(new String[] {"config=a", "config=b"}).get("config"));
  }

  @Test
  void rejectsMalformedArgs() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=v"}));
  }
}
