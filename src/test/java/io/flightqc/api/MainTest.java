package io.flightqc.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter output;

  @BeforeEach
  void setUp() {
    output = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(output, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(output.toString().contains("usage: flightqc"));
  }

  @Test
  void helpFlagOrCommandPrintsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"help"}));
    assertTrue(output.toString().contains("analyze     Extract geotags"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void flagsBeforeCommandReachTheCommand() {
    ExitCode code = Main.run(new String[] {"--help", "analyze"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(output.toString().contains("FlightQC site analysis"));
  }
}
