package tecomp.expr;

public enum DataType {
  INT("int"),
  BOOL("bool"),
  FLOAT("float");

  private final String text;

  DataType(String text) {
    this.text = text;
  }

  public boolean isInt() {
    return this == INT;
  }

  public boolean isBool() {
    return this == BOOL;
  }

  public boolean isFloat() {
    return this == FLOAT;
  }

  public String text() {
    return text;
  }
}
