package ca.gc.cra.spectra.infrastructure.envi;

import java.nio.ByteBuffer;
import java.util.Optional;

/** ENVI {@code data type} codes supported by {@link EnviCubeLoader}. */
public enum EnviDataType {
  UINT8(1, 1),
  INT16(2, 2),
  INT32(3, 4),
  FLOAT32(4, 4),
  FLOAT64(5, 8),
  UINT16(12, 2),
  UINT32(13, 4),
  INT64(14, 8),
  UINT64(15, 8);

  private final int code;
  private final int bytes;

  EnviDataType(int code, int bytes) {
    this.code = code;
    this.bytes = bytes;
  }

  /**
   * Looks up a type by its header code.
   *
   * @param code value of the {@code data type} header key
   * @return matching type, or empty for codes such as complex types that are not supported
   */
  public static Optional<EnviDataType> fromCode(int code) {
    for (EnviDataType type : values()) {
      if (type.code == code) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  public int code() {
    return code;
  }

  /** Size of one sample in bytes. */
  public int bytes() {
    return bytes;
  }

  /**
   * Decodes one sample at an absolute buffer position.
   *
   * @param buffer buffer already set to the file's byte order
   * @param offset absolute byte offset
   * @return sample value widened to {@code double}
   */
  double read(ByteBuffer buffer, int offset) {
    return switch (this) {
      case UINT8 -> buffer.get(offset) & 0xFF;
      case INT16 -> buffer.getShort(offset);
      case INT32 -> buffer.getInt(offset);
      case FLOAT32 -> buffer.getFloat(offset);
      case FLOAT64 -> buffer.getDouble(offset);
      case UINT16 -> buffer.getShort(offset) & 0xFFFF;
      case UINT32 -> buffer.getInt(offset) & 0xFFFFFFFFL;
      case INT64 -> buffer.getLong(offset);
      case UINT64 -> unsigned(buffer.getLong(offset));
    };
  }

  private static double unsigned(long value) {
    double high = (double) (value >>> 1) * 2.0;
    return high + (value & 1L);
  }
}
