package com.consullo.standby.core;

/**
 * Immutable view of the active reminder, as shown to the presentation layer.
 *
 * <p>
 * The id identifies the session that an acknowledgment refers to. A prompt
 * that acknowledges with an older id is ignored by the core.
 * </p>
 */
public final class ReminderSnapshot {

  private final long id;
  private final String text;
  private final Theme theme;
  private final boolean visible;

  private ReminderSnapshot(Builder b) {
    this.id = b.id;
    this.text = b.text;
    this.theme = b.theme;
    this.visible = b.visible;
  }

  public long getId() {
    return id;
  }

  public String getText() {
    return text;
  }

  public Theme getTheme() {
    return theme;
  }

  public boolean isVisible() {
    return visible;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private long id;
    private String text;
    private Theme theme;
    private boolean visible;

    private Builder() {
    }

    public Builder id(long id) {
      this.id = id;
      return this;
    }

    public Builder text(String text) {
      this.text = text;
      return this;
    }

    public Builder theme(Theme theme) {
      this.theme = theme;
      return this;
    }

    public Builder visible(boolean visible) {
      this.visible = visible;
      return this;
    }

    public ReminderSnapshot build() {
      if (text == null) {
        text = "";
      }
      if (theme == null) {
        theme = Theme.NIGHT;
      }
      if (id < 0) {
        throw new IllegalArgumentException("id must not be negative.");
      }
      return new ReminderSnapshot(this);
    }
  }
}
