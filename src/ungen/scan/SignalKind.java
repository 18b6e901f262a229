package ungen.scan;

/** Net kind of a declared or assigned signal. */
public enum SignalKind {
  /** Continuously driven, combinational. */
  WIRE("wire"),
  /** Driven by procedural assignments on clock edges. */
  REG("reg");

  private final String keyword;

  SignalKind(String keyword) { this.keyword = keyword; }

  /** The Verilog keyword declaring this kind. */
  public String getKeyword() { return keyword; }
}
