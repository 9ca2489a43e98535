package com.idiomchain.infrastructure;

import static org.junit.jupiter.api.Assertions.*;

import com.idiomchain.application.DictionaryNotReadyException;
import com.idiomchain.application.UnknownIdiomException;
import com.idiomchain.domain.Idiom;
import com.idiomchain.domain.LoadOptions;
import com.idiomchain.domain.PathStrategy;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class IdiomGraphServiceTest {

  private static IdiomGraphService loaded(Path tmp, String... lines) throws IOException {
    Path file = tmp.resolve("idioms.txt");
    Files.write(file, List.of(lines), StandardCharsets.UTF_8);
    IdiomGraphService svc = new IdiomGraphService(new TextFileIdiomSource(file), LoadOptions.defaults());
    svc.load();
    return svc;
  }

  @Test
  void answersQueriesAfterLoad(@TempDir Path tmp) throws IOException {
    IdiomGraphService svc = loaded(tmp, "爱屋及乌", "乌烟瘴气", "气壮山河", "", "乌");

    assertTrue(svc.isReady());
    assertEquals(3, svc.size());
    assertEquals(PathStrategy.ALL_PAIRS, svc.pathStrategy());
    assertEquals("乌烟瘴气", svc.find("乌烟瘴气").text());
    assertEquals(
        List.of("爱屋及乌", "乌烟瘴气", "气壮山河"),
        svc.shortestChain("爱屋及乌", "气壮山河").stream().map(Idiom::text).toList());
    assertEquals(1, svc.beginWith("乌".codePointAt(0), 0, 16).size());
    assertEquals(1, svc.endWith("乌".codePointAt(0), 0, 16).size());
    assertEquals(1, svc.beginEndWith("气".codePointAt(0), "河".codePointAt(0), 0, 16).size());
  }

  @Test
  @DisplayName("Unknown idiom on either side is reported, not turned into an empty chain")
  void unknownIdiom(@TempDir Path tmp) throws IOException {
    IdiomGraphService svc = loaded(tmp, "爱屋及乌", "乌烟瘴气");

    UnknownIdiomException e1 =
        assertThrows(UnknownIdiomException.class, () -> svc.shortestChain("画蛇添足", "乌烟瘴气"));
    assertEquals("画蛇添足", e1.text());
    UnknownIdiomException e2 =
        assertThrows(UnknownIdiomException.class, () -> svc.shortestChain("爱屋及乌", "乌"));
    assertEquals("乌", e2.text());
    assertTrue(svc.shortestChain("乌烟瘴气", "爱屋及乌").isEmpty());
  }

  @Test
  void queriesBeforeLoadFail(@TempDir Path tmp) {
    IdiomGraphService svc =
        new IdiomGraphService(new TextFileIdiomSource(tmp.resolve("idioms.txt")), LoadOptions.defaults());

    assertFalse(svc.isReady());
    DictionaryNotReadyException e =
        assertThrows(DictionaryNotReadyException.class, () -> svc.find("爱屋及乌"));
    assertTrue(e.getMessage().contains("not loaded"));
    assertThrows(DictionaryNotReadyException.class, () -> svc.shortestChain("爱屋及乌", "乌烟瘴气"));
    assertThrows(DictionaryNotReadyException.class, svc::size);
  }

  @Test
  @DisplayName("A line with invalid UTF-8 is decoded with replacement characters, not fatal")
  void invalidUtf8LineDoesNotAbortTheLoad(@TempDir Path tmp) throws IOException {
    Path file = tmp.resolve("idioms.txt");
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    bytes.write("爱屋及乌\n".getBytes(StandardCharsets.UTF_8));
    // truncated three-byte sequence followed by ASCII
    bytes.write(new byte[] {(byte) 0xE4, (byte) 0xB9, 'x', 'y', '\n'});
    bytes.write(new byte[] {(byte) 0xFF, '\n'});
    bytes.write("乌烟瘴气\n".getBytes(StandardCharsets.UTF_8));
    Files.write(file, bytes.toByteArray());

    IdiomGraphService svc = new IdiomGraphService(new TextFileIdiomSource(file), LoadOptions.defaults());
    svc.load();

    assertTrue(svc.isReady());
    assertNotNull(svc.find("爱屋及乌"));
    assertNotNull(svc.find("乌烟瘴气"));
    assertEquals(3, svc.size());
    assertEquals(1, svc.endWith('y', 0, -1).size());
    assertEquals(
        List.of("爱屋及乌", "乌烟瘴气"),
        svc.shortestChain("爱屋及乌", "乌烟瘴气").stream().map(Idiom::text).toList());
  }

  @Test
  void missingFileIsFatal(@TempDir Path tmp) {
    IdiomGraphService svc =
        new IdiomGraphService(new TextFileIdiomSource(tmp.resolve("missing.txt")), LoadOptions.defaults());

    IllegalStateException e = assertThrows(IllegalStateException.class, svc::load);
    assertTrue(e.getMessage().contains("Idiom file not found"));
    assertFalse(svc.isReady());
  }

  @Test
  void readFailureLeavesNothingPublished() {
    IdiomSource broken =
        new IdiomSource() {
          @Override
          public com.idiomchain.domain.IdiomGraph load(LoadOptions options) throws IOException {
            throw new IOException("boom");
          }

          @Override
          public String describe() {
            return "broken";
          }
        };
    IdiomGraphService svc = new IdiomGraphService(broken, LoadOptions.defaults());

    assertThrows(IOException.class, svc::load);
    assertFalse(svc.isReady());
  }

  @Test
  void loadsOnlyOnce(@TempDir Path tmp) throws IOException {
    IdiomGraphService svc = loaded(tmp, "爱屋及乌");
    assertThrows(IllegalStateException.class, svc::load);
  }

  @Test
  void configuredConstructorParsesStrategy(@TempDir Path tmp) throws IOException {
    Path file = tmp.resolve("idioms.txt");
    Files.write(file, List.of("ab", "bc"), StandardCharsets.UTF_8);

    IdiomGraphService svc =
        new IdiomGraphService(file.toString(), "", "SELECT idiom FROM idioms", 0, " per_query ", 4096);
    svc.load();

    assertEquals(PathStrategy.PER_QUERY, svc.pathStrategy());
    assertEquals(2, svc.shortestChain("ab", "bc").size());
  }

  @Test
  void sourceSelection() {
    assertInstanceOf(
        SqliteIdiomSource.class,
        IdiomGraphService.selectSource("idioms.txt", "jdbc:sqlite:idioms.db", "SELECT 1"));
    assertInstanceOf(
        TextFileIdiomSource.class, IdiomGraphService.selectSource("idioms.txt", " ", "SELECT 1"));
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> IdiomGraphService.selectSource("", "", "q"));
    assertTrue(e.getMessage().contains("No idiom dictionary configured"));
  }
}
