package ca.gc.cra.spectra.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"file=a.0", " sheet=AB 2D NO ", "opus.importParams=SNM,INS"});
    assertEquals("a.0", map.get("file"));
    assertEquals("AB 2D NO", map.get("sheet"));
    assertEquals("SNM,INS", map.get("opus.importParams"));
  }

  @Test
  void valueMayContainEquals() {
    assertEquals("a=b", CliArgsParser.toMap(new String[] {"sheet=a=b"}).get("sheet"));
  }

  @Test
  void rejectsBareTokensAndEmptyValues() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"file="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
  }

  @Test
  void rejectsUnsafeKeysAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"fi le=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"file=a\u0000b"}));
  }

  @Test
  void nullArgsGiveEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void cliInputSeparatesFlags() {
    CliInput input = CliInput.parse(new String[] {"inspect", "-V", "file=x", "--HELP", " "});

    assertTrue(input.verbose());
    assertTrue(input.help());
    assertArrayEquals(new String[] {"inspect", "file=x"}, input.keyValueArgs());
  }
}
