package ca.gc.cra.kafkarecon.config;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses a client configuration file into a flat key/value map.
 *
 * <p>The document must be a JSON object whose values are strings, numbers, booleans, or arrays of those. The
 * whole document is read before anything is returned, so callers either get every entry or an exception.</p>
 *
 * @since 0.1.0
 */
public final class JsonConfigLoader {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Reads and validates the configuration file at {@code path}.
   *
   * @param path JSON document location
   * @return insertion-ordered map of the document's entries; arrays are returned as immutable lists
   * @throws ConfigLoadException when the file is unreadable, malformed, or not a flat object
   */
  public Map<String, Object> load(Path path) throws ConfigLoadException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        JsonParser parser = factory.createParser(reader)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new ConfigLoadException(path, ConfigLoadException.Reason.MALFORMED, "Empty document", null);
      }
      if (token != JsonToken.START_OBJECT) {
        throw new ConfigLoadException(path, ConfigLoadException.Reason.NOT_AN_OBJECT,
            "Configuration must be an object", null);
      }
      Map<String, Object> entries = readObject(path, parser);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new ConfigLoadException(path, ConfigLoadException.Reason.MALFORMED,
            "JSON document contains trailing content", null);
      }
      return entries;
    } catch (JsonParseException ex) {
      throw new ConfigLoadException(path, ConfigLoadException.Reason.MALFORMED,
          "Invalid JSON: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new ConfigLoadException(path, ConfigLoadException.Reason.UNREADABLE,
          "Unable to read file", ex);
    }
  }

  private Map<String, Object> readObject(Path path, JsonParser parser)
      throws IOException, ConfigLoadException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new ConfigLoadException(path, ConfigLoadException.Reason.MALFORMED,
            "Expected field name but found " + token, null);
      }
      String key = parser.currentName();
      JsonToken valueToken = parser.nextToken();
      if (valueToken == JsonToken.START_ARRAY) {
        map.put(key, readArray(path, parser, key));
      } else {
        map.put(key, readScalar(path, parser, valueToken, key));
      }
    }
    return map;
  }

  private List<Object> readArray(Path path, JsonParser parser, String key)
      throws IOException, ConfigLoadException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readScalar(path, parser, token, key));
    }
    return List.copyOf(list);
  }

  private Object readScalar(Path path, JsonParser parser, JsonToken token, String key)
      throws IOException, ConfigLoadException {
    if (token == null) {
      throw new ConfigLoadException(path, ConfigLoadException.Reason.MALFORMED,
          "Unexpected end of document", null);
    }
    return switch (token) {
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      default -> throw new ConfigLoadException(path, ConfigLoadException.Reason.UNSUPPORTED_VALUE,
          "Unsupported value for key " + key + ": " + token, null);
    };
  }
}
