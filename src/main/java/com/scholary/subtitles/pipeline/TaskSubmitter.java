package com.scholary.subtitles.pipeline;

import java.io.IOException;

/** Submits a long-running remote task and returns its id. */
@FunctionalInterface
public interface TaskSubmitter {

  String submit(ProjectContext context) throws IOException;
}
