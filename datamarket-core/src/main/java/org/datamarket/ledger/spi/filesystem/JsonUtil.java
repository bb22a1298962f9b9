/*
 * Copyright 2013 Cloudera Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.datamarket.ledger.spi.filesystem;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import org.datamarket.ledger.LedgerIOException;

public class JsonUtil {

  private JsonUtil() {
  }

  public static JsonNode parse(String json) {
    ObjectMapper mapper = new ObjectMapper();
    try {
      return mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new LedgerIOException("Invalid JSON", e);
    }
  }

  public static JsonNode parse(File file) {
    ObjectMapper mapper = new ObjectMapper();
    try {
      return mapper.readTree(file);
    } catch (JsonProcessingException e) {
      throw new LedgerIOException("Invalid JSON in " + file, e);
    } catch (IOException e) {
      throw new LedgerIOException("Cannot read " + file, e);
    }
  }

  public static String toString(JsonNode node, boolean pretty) {
    StringWriter writer = new StringWriter();
    JsonGenerator gen;
    try {
      gen = new JsonFactory().createGenerator(writer);
      if (pretty) {
        gen.useDefaultPrettyPrinter();
      }
      gen.setCodec(new ObjectMapper());
      gen.writeTree(node);
      gen.close();
    } catch (IOException e) {
      throw new LedgerIOException("Cannot write to JSON generator", e);
    }
    return writer.toString();
  }
}
