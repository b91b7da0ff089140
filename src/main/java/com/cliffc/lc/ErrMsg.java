package com.cliffc.lc;

// Error messages.  All are recoverable: the REPL reports them and reads the
// next line.
public class ErrMsg extends RuntimeException {

  // Error levels
  public enum Level {
    ParseError,               // Malformed syntax
    UnknownShorthand,         // Braced reference to an undefined name
    ReservedName,             // Digit-only shorthand name
    Unbound,                  // Free variables where a closed term is required
    NonTermination,           // Step cap exceeded
    Cancelled,                // Cancellation token fired between steps
  }

  public final Level _lvl;      // Kind of error
  public final String _loc;     // Printable code context with a caret, or null

  ErrMsg(Level lvl, String msg, String loc) { super(msg); _lvl=lvl; _loc=loc; }

  public static ErrMsg syntax(Parse loc, String msg) {
    return new ErrMsg(Level.ParseError,msg,loc==null ? null : loc.errLocMsg(Level.ParseError+": "+msg));
  }
  public static ErrMsg unknown(Parse loc, String name) {
    String msg = "Undefined shorthand {"+name+"}";
    return new ErrMsg(Level.UnknownShorthand,msg,loc==null ? null : loc.errLocMsg(Level.UnknownShorthand+": "+msg));
  }
  public static ErrMsg reserved(String name) {
    return new ErrMsg(Level.ReservedName,"Church numerals cannot be redefined: {"+name+"}",null);
  }
  public static ErrMsg unbound(String msg) {
    return new ErrMsg(Level.Unbound,msg,null);
  }
  public static ErrMsg cancelled(int steps) {
    return new ErrMsg(Level.Cancelled,"Reduction cancelled after "+steps+" steps",null);
  }

  /** Step cap exceeded.  The steps themselves were already handed out as
   *  they were made. */
  public static class NonTermination extends ErrMsg {
    public final int _steps;    // Steps taken before giving up
    NonTermination( int steps ) {
      super(Level.NonTermination,"No normal form after "+steps+" steps; reduction may not terminate",null);
      _steps = steps;
    }
  }

  // Printable message, with code context if known; always ends in a newline
  public String msg() {
    return _loc==null ? _lvl+": "+getMessage()+System.lineSeparator() : _loc;
  }

  @Override public String toString() { return _lvl+": "+getMessage(); }
}
