package com.scholary.subtitles.project;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks at startup that {@link Stage} and the persisted {@link ProjectRecord} layout agree.
 *
 * <p>A fresh record is serialized with the application's {@link ObjectMapper}; its {@code is_*}
 * properties must appear exactly in {@link Stage} declaration order under the stage flag names.
 * Each stage's marker must also set its own flag and no other. Any mismatch fails context
 * startup.
 */
@Component
public class StageSchemaVerifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(StageSchemaVerifier.class);
  private static final String FLAG_PREFIX = "is_";

  public StageSchemaVerifier(ObjectMapper objectMapper) {
    verify(objectMapper);
  }

  static void verify(ObjectMapper objectMapper) {
    ProjectRecord sample =
        ProjectRecord.create(new VideoSource(VideoPlatform.BILIBILI, "BV0000000000"), null);

    List<String> expected =
        Arrays.stream(Stage.values()).map(Stage::flagName).collect(Collectors.toList());
    List<String> actual = persistedFlags(objectMapper.valueToTree(sample));
    if (!expected.equals(actual)) {
      throw new IllegalStateException(
          String.format("Stage flags %s do not match persisted record flags %s", expected, actual));
    }

    for (Stage stage : Stage.values()) {
      ProjectRecord record =
          ProjectRecord.create(new VideoSource(VideoPlatform.BILIBILI, "BV0000000000"), null);
      record.markCompleted(stage);
      for (Stage other : Stage.values()) {
        if (record.isCompleted(other) != (other == stage)) {
          throw new IllegalStateException(
              String.format("Marking %s changed the flag of %s", stage, other));
        }
      }
    }

    LOGGER.info(
        "Stage schema verified: {} stages, schema version {}",
        expected.size(),
        ProjectRecord.SCHEMA_VERSION);
  }

  private static List<String> persistedFlags(JsonNode node) {
    List<String> flags = new ArrayList<>();
    Iterator<String> names = node.fieldNames();
    while (names.hasNext()) {
      String name = names.next();
      if (name.startsWith(FLAG_PREFIX)) {
        flags.add(name);
      }
    }
    return flags;
  }
}
