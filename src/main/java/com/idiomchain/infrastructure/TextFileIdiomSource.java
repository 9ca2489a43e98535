package com.idiomchain.infrastructure;

import com.idiomchain.domain.IdiomGraph;
import com.idiomchain.domain.IdiomGraphLoader;
import com.idiomchain.domain.LoadOptions;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** UTF-8 text file with one idiom per line; invalid bytes become U+FFFD. */
public class TextFileIdiomSource implements IdiomSource {
  private final Path file;

  public TextFileIdiomSource(Path file) {
    this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
  }

  @Override
  public IdiomGraph load(LoadOptions options) throws IOException {
    if (Files.notExists(file)) throw new IllegalStateException("Idiom file not found: " + file);
    // malformed byte sequences decode to U+FFFD instead of failing the whole load
    try (BufferedReader in =
        new BufferedReader(
            new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
      return IdiomGraphLoader.load(in::readLine, options);
    }
  }

  @Override
  public String describe() {
    return file.toString();
  }
}
