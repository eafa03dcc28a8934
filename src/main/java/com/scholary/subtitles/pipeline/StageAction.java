package com.scholary.subtitles.pipeline;

import java.io.IOException;

/**
 * The work for one stage.
 *
 * <p>An action produces its artifacts and may update non-flag fields of the record; it never sets
 * completion flags. Any exception it throws fails the stage.
 */
@FunctionalInterface
public interface StageAction {

  void execute(ProjectContext context) throws IOException;
}
