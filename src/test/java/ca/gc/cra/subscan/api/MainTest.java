package ca.gc.cra.subscan.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private final StringWriter out = new StringWriter();

  @BeforeEach
  void captureOutput() {
    CliPrinter.setWriterForTesting(new PrintWriter(out, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(out.toString().contains("usage: subscan <active|passive> [options]"));
  }

  @Test
  void globalHelpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(out.toString().contains("SubScan subdomain discovery"));
  }

  @Test
  void dispatchesToActiveAndPassive() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"active", "--help"}));
    assertTrue(out.toString().contains("SubScan active scan"));

    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"PASSIVE", "--help"}));
    assertTrue(out.toString().contains("SubScan passive enumeration"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture", "domain=example.com"}));
    assertTrue(out.toString().contains("usage: subscan"));
  }

  @Test
  void exitCodesAreStable() {
    assertEquals(0, ExitCode.SUCCESS.code());
    assertEquals(2, ExitCode.INVALID_ARGS.code());
    assertEquals(130, ExitCode.INTERRUPTED.code());
  }
}
