/*
 * Where: proximity codec
 * What: encodes and decodes proximity frames in the tagged, URI and raw text sub-formats
 * Why: readers receive arbitrary frames from nearby tags and must classify them without context
 */
package com.tickety.proximity;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Wire codec for proximity frames.
 *
 * <ul>
 *   <li>Tagged text: {@code TICKETY_PAY:<subject>[#<hint>]} or {@code TICKETY_CLAIM:...}
 *   <li>URI: one prefix-table byte followed by the rest of
 *       {@code https://tickety.app/h1/<pay|claim>/<subject>[?c=<hint>]}
 *   <li>Raw text: a bare customer identifier
 * </ul>
 *
 * <p>{@link #decode(byte[])} tries the tag, then the URI table, then raw text, and never throws.
 * The three sub-formats cannot be confused: tagged frames start with an upper-case letter and
 * contain a colon, URI frames start with a byte below {@code 0x24}, and identifiers never contain
 * a colon.
 */
public class ProximityPayloadCodec {

  public static final int MAX_FRAME_BYTES = 1024;

  static final String URI_HOST = "tickety.app";
  static final String URI_VERSION_SEGMENT = "h1";
  private static final String URI_BASE = "https://" + URI_HOST + "/" + URI_VERSION_SEGMENT + "/";
  private static final String URI_HINT_PARAM = "?c=";
  private static final String TAG_FAMILY = "TICKETY_";
  private static final char TAG_SEPARATOR = ':';
  private static final char HINT_SEPARATOR = '#';
  private static final int NDEF_LANGUAGE_LENGTH_MASK = 0x3F;
  private static final int NDEF_UTF16_FLAG = 0x80;

  public byte[] encode(ProximityPayload payload, ProximityFormat format) {
    final byte[] frame =
        switch (format) {
          case TAGGED_TEXT -> utf8(encodeTagged(payload));
          case URI -> encodeUri(payload);
          case RAW_TEXT -> utf8(encodeRaw(payload));
        };
    if (frame.length > MAX_FRAME_BYTES) {
      throw new IllegalArgumentException("payload exceeds proximity frame limit");
    }
    return frame;
  }

  /** Tagged text is the default sub-format because it carries every field. */
  public byte[] encode(ProximityPayload payload) {
    return encode(payload, ProximityFormat.TAGGED_TEXT);
  }

  public DecodeResult decode(byte[] frame) {
    if (frame == null || frame.length == 0) {
      return DecodeResult.malformed("empty frame");
    }
    if (frame.length > MAX_FRAME_BYTES) {
      return DecodeResult.malformed("frame exceeds limit");
    }
    if ((frame[0] & 0xFF) < UriPrefixTable.SIZE) {
      return decodeUri(frame);
    }
    final Optional<String> text = strictUtf8(frame, 0);
    if (text.isEmpty()) {
      return DecodeResult.malformed("frame is not valid UTF-8");
    }
    if (text.get().startsWith(TAG_FAMILY) && text.get().indexOf(TAG_SEPARATOR) > 0) {
      return decodeTagged(text.get());
    }
    return decodeRaw(text.get());
  }

  /**
   * Decodes the payload of an NDEF well-known text record: status byte, language code, then text.
   */
  public DecodeResult decodeTextRecord(byte[] recordPayload) {
    if (recordPayload == null || recordPayload.length < 1) {
      return DecodeResult.malformed("empty text record");
    }
    final int status = recordPayload[0] & 0xFF;
    final int languageLength = status & NDEF_LANGUAGE_LENGTH_MASK;
    final int textStart = 1 + languageLength;
    if (textStart > recordPayload.length) {
      return DecodeResult.malformed("text record is truncated");
    }
    if ((status & NDEF_UTF16_FLAG) == 0) {
      return decode(Arrays.copyOfRange(recordPayload, textStart, recordPayload.length));
    }
    final String text =
        new String(
            recordPayload, textStart, recordPayload.length - textStart, StandardCharsets.UTF_16);
    return decode(utf8(text));
  }

  private String encodeTagged(ProximityPayload payload) {
    final StringBuilder builder =
        new StringBuilder(payload.kind().namespace())
            .append(TAG_SEPARATOR)
            .append(payload.subjectId());
    payload.hint().ifPresent(hint -> builder.append(HINT_SEPARATOR).append(hint));
    return builder.toString();
  }

  private byte[] encodeUri(ProximityPayload payload) {
    final StringBuilder uri =
        new StringBuilder(URI_BASE)
            .append(payload.kind().uriSegment())
            .append('/')
            .append(payload.subjectId());
    payload.hint().ifPresent(hint -> uri.append(URI_HINT_PARAM).append(hint));
    final String full = uri.toString();
    final int index = UriPrefixTable.indexFor(full);
    final String prefix = UriPrefixTable.prefix(index).orElse("");
    final byte[] suffix = utf8(full.substring(prefix.length()));
    final byte[] frame = new byte[suffix.length + 1];
    frame[0] = (byte) index;
    System.arraycopy(suffix, 0, frame, 1, suffix.length);
    return frame;
  }

  private String encodeRaw(ProximityPayload payload) {
    if (payload.kind() != PayloadKind.CUSTOMER_IDENTITY || payload.correlationHint() != null) {
      throw new IllegalArgumentException("raw text carries only a customer identifier");
    }
    return payload.subjectId();
  }

  private DecodeResult decodeTagged(String text) {
    final int separator = text.indexOf(TAG_SEPARATOR);
    final PayloadKind kind = PayloadKind.fromNamespace(text.substring(0, separator));
    if (kind == null) {
      return DecodeResult.malformed("unknown tag");
    }
    final String body = text.substring(separator + 1);
    final int hintIndex = body.indexOf(HINT_SEPARATOR);
    final String subject = hintIndex < 0 ? body : body.substring(0, hintIndex);
    final String hint = hintIndex < 0 ? null : body.substring(hintIndex + 1);
    return build(kind, subject, hint, ProximityFormat.TAGGED_TEXT);
  }

  private DecodeResult decodeUri(byte[] frame) {
    final Optional<String> prefix = UriPrefixTable.prefix(frame[0] & 0xFF);
    final Optional<String> suffix = strictUtf8(frame, 1);
    if (prefix.isEmpty() || suffix.isEmpty()) {
      return DecodeResult.malformed("uri record is not valid");
    }
    final String uri = prefix.get() + suffix.get();
    if (!uri.startsWith(URI_BASE)) {
      return DecodeResult.malformed("uri is not a handoff link");
    }
    final String path = uri.substring(URI_BASE.length());
    final int slash = path.indexOf('/');
    if (slash < 0) {
      return DecodeResult.malformed("uri has no subject");
    }
    final PayloadKind kind = PayloadKind.fromUriSegment(path.substring(0, slash));
    if (kind == null) {
      return DecodeResult.malformed("uri kind is unknown");
    }
    final String rest = path.substring(slash + 1);
    final int query = rest.indexOf('?');
    if (query < 0) {
      return build(kind, rest, null, ProximityFormat.URI);
    }
    if (!rest.startsWith(URI_HINT_PARAM, query)) {
      return DecodeResult.malformed("uri query is unknown");
    }
    return build(
        kind,
        rest.substring(0, query),
        rest.substring(query + URI_HINT_PARAM.length()),
        ProximityFormat.URI);
  }

  private DecodeResult decodeRaw(String text) {
    return build(PayloadKind.CUSTOMER_IDENTITY, text, null, ProximityFormat.RAW_TEXT);
  }

  private DecodeResult build(
      PayloadKind kind, String subject, String hint, ProximityFormat format) {
    if (!ProximityPayload.isIdentifier(subject, ProximityPayload.MAX_SUBJECT_LENGTH)) {
      return DecodeResult.malformed("subject is invalid");
    }
    if (hint != null && !ProximityPayload.isIdentifier(hint, ProximityPayload.MAX_HINT_LENGTH)) {
      return DecodeResult.malformed("hint is invalid");
    }
    return DecodeResult.decoded(new ProximityPayload(kind, subject, hint), format);
  }

  private static Optional<String> strictUtf8(byte[] bytes, int offset) {
    final CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      final CharBuffer chars = decoder.decode(ByteBuffer.wrap(bytes, offset, bytes.length - offset));
      return Optional.of(chars.toString());
    } catch (CharacterCodingException ex) {
      return Optional.empty();
    }
  }

  private static byte[] utf8(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
