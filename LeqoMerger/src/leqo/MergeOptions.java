package leqo;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class MergeOptions {
  public static final String DEFAULT_REGISTER_NAME = "leqo_reg";

  private static final MergeOptions DEFAULTS = builder().build();

  public abstract String globalRegisterName();

  public abstract boolean optimizeWidth();

  public abstract NodeSelector nodeSelector();

  public abstract boolean strictAncillaDemand();

  public abstract String openqasmVersion();

  public static MergeOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new AutoValue_MergeOptions.Builder()
        .setGlobalRegisterName(DEFAULT_REGISTER_NAME)
        .setOptimizeWidth(false)
        .setNodeSelector(NodeSelector.satisfiableFirst())
        .setStrictAncillaDemand(false)
        .setOpenqasmVersion(Program.DEFAULT_VERSION);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setGlobalRegisterName(String globalRegisterName);

    public abstract Builder setOptimizeWidth(boolean optimizeWidth);

    public abstract Builder setNodeSelector(NodeSelector nodeSelector);

    public abstract Builder setStrictAncillaDemand(boolean strictAncillaDemand);

    public abstract Builder setOpenqasmVersion(String openqasmVersion);

    public abstract MergeOptions build();
  }
}
