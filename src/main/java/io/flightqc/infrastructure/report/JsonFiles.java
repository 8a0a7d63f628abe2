package io.flightqc.infrastructure.report;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Writes JSON documents through a temporary sibling file so readers never observe a partial document. */
final class JsonFiles {
  private static final JsonFactory FACTORY = new JsonFactory();

  private JsonFiles() {}

  @FunctionalInterface
  interface Body {
    void write(JsonGenerator gen) throws IOException;
  }

  static Path write(Path target, Body body) throws IOException {
    Path parent = target.toAbsolutePath().getParent();
    Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
    try {
      try (OutputStream out = Files.newOutputStream(temp);
          JsonGenerator gen = FACTORY.createGenerator(out, JsonEncoding.UTF8)) {
        gen.useDefaultPrettyPrinter();
        body.write(gen);
      }
      return Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  static String toString(Body body) throws IOException {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      body.write(gen);
    }
    return out.toString();
  }
}
