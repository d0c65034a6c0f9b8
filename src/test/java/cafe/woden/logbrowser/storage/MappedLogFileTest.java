package cafe.woden.logbrowser.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MappedLogFileTest {

  @TempDir Path dir;

  @Test
  void mapsInSegmentsOfTheRequestedSize() throws IOException {
    MappedLogFile file = MappedLogFile.map(write("0123456789abcdefghij"), 8);

    assertEquals(20, file.size());
    assertEquals(3, file.segmentCount());
    assertEquals('9', file.byteAt(9));
    assertEquals('j', file.byteAt(19));
  }

  @Test
  void sliceInsideOneSegmentIsAReadOnlyViewOfTheMapping() throws IOException {
    MappedLogFile file = MappedLogFile.map(write("0123456789abcdefghij"), 8);

    ByteBuffer slice = file.slice(1, 5);

    assertTrue(slice.isReadOnly());
    assertTrue(slice.isDirect());
    assertEquals("12345", StandardCharsets.US_ASCII.decode(slice).toString());
  }

  @Test
  void sliceAcrossSegmentsIsJoined() throws IOException {
    MappedLogFile file = MappedLogFile.map(write("0123456789abcdefghij"), 8);

    ByteBuffer slice = file.slice(6, 12);

    assertTrue(slice.isReadOnly());
    assertFalse(slice.isDirect());
    assertEquals("6789abcdefgh", StandardCharsets.US_ASCII.decode(slice).toString());
  }

  @Test
  void emptySliceAndOutOfRangeAccess() throws IOException {
    MappedLogFile file = MappedLogFile.map(write("abc"));

    assertEquals(0, file.slice(3, 0).remaining());
    assertThrows(IndexOutOfBoundsException.class, () -> file.slice(2, 5));
    assertThrows(IndexOutOfBoundsException.class, () -> file.byteAt(3));
  }

  @Test
  void rejectsNonPositiveSegmentSize() throws IOException {
    Path p = write("abc");

    assertThrows(IllegalArgumentException.class, () -> MappedLogFile.map(p, 0));
  }

  private Path write(String content) throws IOException {
    return Files.write(dir.resolve("data.log"), content.getBytes(StandardCharsets.US_ASCII));
  }
}
