package com.aina.backend.llm.orchestration;

import org.springframework.util.StringUtils;

/**
 * Instructions used when an oversized request is map-reduced automatically. They repeat the
 * beginning of the user's task so that every chunk is read with the goal in mind.
 */
public record MapReduceInstructions(String mapInstruction, String reduceInstruction) {

  static final int MAP_TASK_PREVIEW_CHARS = 500;
  static final int REDUCE_TASK_PREVIEW_CHARS = 300;

  public static MapReduceInstructions forUserTask(String userPrompt, String systemPrompt) {
    String mapInstruction =
        "TASCA ORIGINAL DE L'USUARI:\n"
            + preview(userPrompt, MAP_TASK_PREVIEW_CHARS)
            + "\n\nAnalitza aquesta secció del document i extreu la informació rellevant per respondre a la tasca de l'usuari:";
    if (StringUtils.hasText(systemPrompt)) {
      mapInstruction = systemPrompt + "\n\n" + mapInstruction;
    }
    String reduceInstruction =
        "TASCA ORIGINAL DE L'USUARI:\n"
            + preview(userPrompt, REDUCE_TASK_PREVIEW_CHARS)
            + "\n\nA continuació tens els resultats parcials de l'anàlisi de diferents seccions del document.\n"
            + "Sintetitza tota la informació en una resposta final coherent i completa que respongui directament a la tasca de l'usuari.\n"
            + "No repeteixis informació. Prioritza els punts més rellevants.";
    return new MapReduceInstructions(mapInstruction, reduceInstruction);
  }

  static String preview(String text, int maxChars) {
    if (text == null) {
      return "";
    }
    return text.length() > maxChars ? text.substring(0, maxChars) + "..." : text;
  }
}
