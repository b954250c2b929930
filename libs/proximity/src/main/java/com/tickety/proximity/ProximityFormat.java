/*
 * Where: proximity codec model
 * What: the wire sub-formats a frame can be written in
 * Why: the encoder picks one explicitly and the decoder reports which one matched
 */
package com.tickety.proximity;

public enum ProximityFormat {
  TAGGED_TEXT,
  URI,
  RAW_TEXT
}
