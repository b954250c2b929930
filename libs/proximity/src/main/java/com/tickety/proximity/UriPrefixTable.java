/*
 * Where: proximity codec
 * What: the fixed NFC Forum URI identifier code table (indexes 0 to 35)
 * Why: URI records abbreviate their scheme to one byte and the decoder must expand it
 */
package com.tickety.proximity;

import java.util.List;
import java.util.Optional;

final class UriPrefixTable {

  private static final List<String> PREFIXES =
      List.of(
          "",
          "http://www.",
          "https://www.",
          "http://",
          "https://",
          "tel:",
          "mailto:",
          "ftp://anonymous:anonymous@",
          "ftp://ftp.",
          "ftps://",
          "sftp://",
          "smb://",
          "nfs://",
          "ftp://",
          "dav://",
          "news:",
          "telnet://",
          "imap:",
          "rtsp://",
          "urn:",
          "pop:",
          "sip:",
          "sips:",
          "tftp:",
          "btspp://",
          "btl2cap://",
          "btgoep://",
          "tcpobex://",
          "irdaobex://",
          "file://",
          "urn:epc:id:",
          "urn:epc:tag:",
          "urn:epc:pat:",
          "urn:epc:raw:",
          "urn:epc:",
          "urn:nfc:");

  static final int SIZE = PREFIXES.size();

  private UriPrefixTable() {}

  static Optional<String> prefix(int index) {
    if (index < 0 || index >= SIZE) {
      return Optional.empty();
    }
    return Optional.of(PREFIXES.get(index));
  }

  /** Longest matching prefix; index 0 (no abbreviation) when nothing matches. */
  static int indexFor(String uri) {
    int best = 0;
    for (int i = 1; i < SIZE; i++) {
      final String candidate = PREFIXES.get(i);
      if (uri.startsWith(candidate) && candidate.length() > PREFIXES.get(best).length()) {
        best = i;
      }
    }
    return best;
  }
}
