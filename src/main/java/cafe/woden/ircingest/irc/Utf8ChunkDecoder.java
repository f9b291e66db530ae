package cafe.woden.ircingest.irc;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Incremental UTF-8 decoding of socket reads.
 *
 * <p>A read can end in the middle of a multi-byte sequence; those trailing bytes are held back and
 * prepended to the next chunk. If that chunk cannot complete them they are discarded and the chunk
 * is decoded alone. Bytes that can never form valid UTF-8 are reported as
 * {@link CharacterCodingException}, after which the decoder starts over from a clean state.
 */
final class Utf8ChunkDecoder {

  private static final ByteBuffer EMPTY = ByteBuffer.allocate(0);

  private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
      .onMalformedInput(CodingErrorAction.REPORT)
      .onUnmappableCharacter(CodingErrorAction.REPORT);

  private ByteBuffer pending = EMPTY;

  String decode(byte[] chunk, int length) throws CharacterCodingException {
    int carried = pending.remaining();
    ByteBuffer in = ByteBuffer.allocate(carried + length);
    in.put(pending).put(chunk, 0, length).flip();

    // UTF-8 never yields more UTF-16 units than input bytes.
    CharBuffer out = CharBuffer.allocate(in.remaining());
    CoderResult result = decoder.decode(in, out, false);
    if (result.isError()) {
      boolean badCarry = in.position() < carried;
      reset();
      if (badCarry) {
        // The held-back prefix was never completed; the new chunk stands on its own.
        return decode(chunk, length);
      }
      result.throwException();
    }

    if (in.hasRemaining()) {
      ByteBuffer carry = ByteBuffer.allocate(in.remaining());
      carry.put(in).flip();
      pending = carry;
    } else {
      pending = EMPTY;
    }
    out.flip();
    return out.toString();
  }

  /** Bytes held back from the previous chunk. */
  int pendingBytes() {
    return pending.remaining();
  }

  void reset() {
    decoder.reset();
    pending = EMPTY;
  }
}
