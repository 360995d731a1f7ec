package yarn.compiler;

/** How far the compiler goes. */
public enum CompilationType {
  /** Every pass: a program, string table, declarations and diagnostics. */
  FULL_COMPILATION,
  /** Stops after type checking: declarations and diagnostics, no program. */
  TYPE_CHECK,
  /** Stops after the string table is built. */
  STRINGS_ONLY;
}
