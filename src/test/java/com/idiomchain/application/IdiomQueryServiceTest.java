package com.idiomchain.application;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.idiomchain.application.port.IdiomDictionary;
import com.idiomchain.domain.Idiom;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Request-value handling of IdiomQueryService; the dictionary itself is mocked. */
public class IdiomQueryServiceTest {

  IdiomDictionary dict;
  IdiomQueryService svc;

  @BeforeEach
  void setUp() {
    dict = mock(IdiomDictionary.class);
    svc = new IdiomQueryService(dict, 16);
  }

  @Test
  @DisplayName("Absent or unparsable paging values fall back to 0 and 16")
  void pagingDefaults() {
    when(dict.beginWith(anyInt(), anyInt(), anyInt())).thenReturn(List.of());

    svc.beginWith("乌", null, null);
    svc.beginWith("乌", "", "abc");
    svc.beginWith("乌", "1.5", "16x");

    verify(dict, times(3)).beginWith("乌".codePointAt(0), 0, 16);
  }

  @Test
  void pagingValuesAreParsedLikeBaseZero() {
    assertEquals(3, IdiomQueryService.parseOr("3", 0));
    assertEquals(-5, IdiomQueryService.parseOr("-5", 0));
    assertEquals(16, IdiomQueryService.parseOr("0x10", 0));
    assertEquals(8, IdiomQueryService.parseOr("010", 0));
    assertEquals(0, IdiomQueryService.parseOr("0", 7));
    assertEquals(-16, IdiomQueryService.parseOr("-0x10", 0));
    assertEquals(5, IdiomQueryService.parseOr("0b101", 0));
    assertEquals(15, IdiomQueryService.parseOr("0o17", 0));
    assertEquals(1000, IdiomQueryService.parseOr("1_000", 0));
    assertEquals(31, IdiomQueryService.parseOr("0x_1F", 0));
  }

  @Test
  @DisplayName("Values beyond 32 bits saturate; malformed literals fall back")
  void pagingValueEdges() {
    assertEquals(Integer.MAX_VALUE, IdiomQueryService.parseOr("99999999999", 7));
    assertEquals(Integer.MIN_VALUE, IdiomQueryService.parseOr("-99999999999", 7));
    assertEquals(7, IdiomQueryService.parseOr("99999999999999999999", 7));
    assertEquals(7, IdiomQueryService.parseOr("#10", 7));
    assertEquals(7, IdiomQueryService.parseOr("0x", 7));
    assertEquals(7, IdiomQueryService.parseOr("08", 7));
    assertEquals(7, IdiomQueryService.parseOr("_1", 7));
    assertEquals(7, IdiomQueryService.parseOr("1_", 7));
    assertEquals(7, IdiomQueryService.parseOr("1__0", 7));
    assertEquals(7, IdiomQueryService.parseOr("--5", 7));
    assertEquals(7, IdiomQueryService.parseOr("+", 7));
  }

  @Test
  void oversizedOffsetMeansPastTheEnd() {
    when(dict.beginWith(anyInt(), anyInt(), anyInt())).thenReturn(List.of());

    svc.beginWith("乌", "99999999999", "0x7fffffffffff");

    verify(dict).beginWith("乌".codePointAt(0), Integer.MAX_VALUE, Integer.MAX_VALUE);
  }

  @Test
  void onlyTheFirstSymbolIsUsed() {
    when(dict.endWith(anyInt(), anyInt(), anyInt())).thenReturn(List.of());
    when(dict.beginEndWith(anyInt(), anyInt(), anyInt(), anyInt())).thenReturn(List.of());

    svc.endWith("气壮", "2", "-1");
    svc.beginEndWith("𠀀x", "河山", "0", "4");

    verify(dict).endWith("气".codePointAt(0), 2, -1);
    verify(dict).beginEndWith(0x20000, "河".codePointAt(0), 0, 4);
  }

  @Test
  void resultsRenderAsTexts() {
    when(dict.beginWith(anyInt(), anyInt(), anyInt()))
        .thenReturn(List.of(new Idiom(0, "乌烟瘴气"), new Idiom(3, "乌合之众")));

    assertEquals(List.of("乌烟瘴气", "乌合之众"), svc.beginWith("乌", "0", "2"));
  }

  @Test
  void shortestChainPassesTextsThrough() {
    when(dict.shortestChain("爱屋及乌", "气壮山河"))
        .thenReturn(
            List.of(new Idiom(0, "爱屋及乌"), new Idiom(1, "乌烟瘴气"), new Idiom(2, "气壮山河")));
    when(dict.shortestChain("气壮山河", "爱屋及乌")).thenReturn(List.of());
    when(dict.shortestChain("画蛇添足", "爱屋及乌")).thenThrow(new UnknownIdiomException("画蛇添足"));

    assertEquals(List.of("爱屋及乌", "乌烟瘴气", "气壮山河"), svc.shortestChain("爱屋及乌", "气壮山河"));
    assertEquals(List.of(), svc.shortestChain("气壮山河", "爱屋及乌"));
    UnknownIdiomException e =
        assertThrows(UnknownIdiomException.class, () -> svc.shortestChain("画蛇添足", "爱屋及乌"));
    assertEquals("not a valid idiom: 画蛇添足", e.getMessage());
  }

  @Test
  void missingWordIsRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> svc.beginWith("", "0", "1"));
    assertTrue(e.getMessage().contains("'b'"));
    assertThrows(IllegalArgumentException.class, () -> svc.endWith(null, null, null));
    assertThrows(IllegalArgumentException.class, () -> svc.shortestChain("爱屋及乌", ""));
    verifyNoInteractions(dict);
  }
}
