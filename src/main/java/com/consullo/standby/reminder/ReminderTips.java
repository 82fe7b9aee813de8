package com.consullo.standby.reminder;

import java.util.List;

/**
 * Prompt texts shown on the reminder.
 *
 * @since 1.0
 */
public final class ReminderTips {

  public static final String DEFAULT_TIP = "Time to stand up and stretch.";

  public static final List<String> ENGLISH = List.of(
      "Smelly butt, smelly butt, please stand up!",
      "Your chakras are literally flattening. Stand up!",
      "The chair is NOT your lobster. Move!",
      "My spirit says your butt needs freedom!",
      "Could you BE sitting any longer?",
      "Could your butt BE any flatter? Stand!",
      "Could this chair BE more attached to you?",
      "So, I'm just gonna DIE here sitting?",
      "Could sitting here BE any sadder? Move!",
      "Your posture is a MESS. Stand up.",
      "If you won't move, I'll MAKE you move!",
      "How YOU sittin'? Get up already!",
      "Stand up or your sandwich gets it!",
      "Oh. My. God. You're STILL sitting?!",
      "Nooo, you can't sit forever. It's like... so bad!");

  private ReminderTips() {
  }
}
