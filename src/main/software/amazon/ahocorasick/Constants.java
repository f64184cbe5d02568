package software.amazon.ahocorasick;

final class Constants {

  private Constants() {
    throw new UnsupportedOperationException("You can't create instance of utility class.");
  }

  // Reserved "no state" id. Terminates failure and dictionary link chains.
  final static int NIL_STATE = 0;

  // Start state of every scan.
  final static int ROOT_STATE = 1;

  final static int ALPHABET_SIZE = 256;

  // log2(ALPHABET_SIZE), used to address a row of the flattened transition table.
  final static int ROW_SHIFT = 8;

  final static int BYTE_MASK = 0xFF;

  // The flattened transition table is a single int[] of stateCount * ALPHABET_SIZE entries.
  final static int MAX_STATES = Integer.MAX_VALUE / ALPHABET_SIZE;

  final static int DEFAULT_MATCH_BUFFER_POOL_SIZE = 64;
  final static int DEFAULT_MATCH_BUFFER_CAPACITY = 16;
}
