package com.gentoro.govdir.utility;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gentoro.govdir.exception.SerializationException;

public class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER =
      JsonMapper.builder()
          .addModule(new JavaTimeModule())
          // Ignore extra fields in persisted state written by older versions
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
          // Stable key order so repeated runs produce identical files
          .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
          .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, false)
          .enable(SerializationFeature.INDENT_OUTPUT)
          .build();

  private static final CsvMapper CSV_MAPPER = new CsvMapper();

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static CsvMapper getCsvMapper() {
    return CSV_MAPPER;
  }

  public static <T> T fromJson(String json, Class<T> type) {
    try {
      return JSON_MAPPER.readValue(json, type);
    } catch (Exception e) {
      throw new SerializationException("Failed to parse JSON into " + type.getSimpleName(), e);
    }
  }

  public static <T> T fromJson(String json, TypeReference<T> type) {
    try {
      return JSON_MAPPER.readValue(json, type);
    } catch (Exception e) {
      throw new SerializationException("Failed to parse JSON into " + type.getType(), e);
    }
  }

  /** Single-line JSON, for log output. */
  public static String toCompactJson(Object object) {
    try {
      return JSON_MAPPER
          .writer()
          .without(SerializationFeature.INDENT_OUTPUT)
          .writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }

  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }
}
