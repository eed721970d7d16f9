package io.b2mash.timeledger.logentry;

/** The mutation an audit entry records. */
public enum LogKind {
  START,
  STOP,
  ADJUST;

  /** Lower-case wire name ({@code start}, {@code stop}, {@code adjust}). */
  public String value() {
    return name().toLowerCase();
  }
}
