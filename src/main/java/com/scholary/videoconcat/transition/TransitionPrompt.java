package com.scholary.videoconcat.transition;

/** Builds the instruction sent to the text generation API for one clip transition. */
public final class TransitionPrompt {

  private static final String TEMPLATE =
      "Based on the text descriptions of the two video clips below, write a coherent and natural"
          + " description for the concatenated video.\n\n"
          + "The first clip shows:\n\"%s\"\n\n"
          + "The current clip shows:\n\"%s\"\n\n"
          + "Write one natural-language paragraph that focuses on the current clip while briefly"
          + " referring to the previous one, so the two read as a smooth transition. Keep it"
          + " concise and logically connected. Do not list frame by frame and do not invent"
          + " content.";

  private TransitionPrompt() {}

  public static String build(String previousDescription, String currentDescription) {
    return String.format(TEMPLATE, previousDescription, currentDescription);
  }
}
