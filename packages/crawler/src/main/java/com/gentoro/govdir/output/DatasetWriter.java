package com.gentoro.govdir.output;

import com.gentoro.govdir.graph.EntityGraph;
import java.nio.file.Path;
import java.util.List;

/** Writes one file per entity collection in a single interchange format. */
public interface DatasetWriter {

  /** File extension and config name, e.g. {@code csv}. */
  String format();

  /** @return the files written */
  List<Path> write(EntityGraph graph, Path directory);
}
