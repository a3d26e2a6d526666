package leqo;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class MergedFragment {
  public abstract Program program();

  public abstract int registerSize();

  public final String toQasm() {
    return QasmPrinter.print(program());
  }

  public static MergedFragment create(Program program, int registerSize) {
    return new AutoValue_MergedFragment(program, registerSize);
  }
}
