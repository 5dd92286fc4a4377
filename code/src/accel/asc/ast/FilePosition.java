package accel.asc.ast;

/**
 * Simple immutable class to record file/line/column of a construct
 *
 */
public class FilePosition {
  public final String file;
  /** 1-based line */
  public final int line;
  /** 0-based column */
  public final int column;

  public FilePosition(String file, int line, int column) {
    super();
    this.file = file;
    this.line = line;
    this.column = column;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((file == null) ? 0 : file.hashCode());
    result = prime * result + line;
    result = prime * result + column;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    FilePosition other = (FilePosition) obj;
    if (file == null) {
      if (other.file != null)
        return false;
    } else if (!file.equals(other.file)) {
      return false;
    }
    return line == other.line && column == other.column;
  }

  @Override
  public String toString() {
    return file + ":" + line + ":" + (column + 1);
  }
}
