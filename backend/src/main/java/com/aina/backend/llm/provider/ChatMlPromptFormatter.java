package com.aina.backend.llm.provider;

import com.aina.backend.llm.model.InvocationRequest;
import org.springframework.util.StringUtils;

/**
 * Renders requests as ChatML for the Salamandra and ALIA backends. Those models need the JSON
 * contract spelled out with examples, and tend to echo their input in free-text mode, so the
 * system turn carries extra Catalan instructions. The anti-echo text is a best-effort nudge.
 */
public final class ChatMlPromptFormatter {

  static final String IM_START = "<|im_start|>";
  static final String IM_END = "<|im_end|>";
  static final String ASSISTANT_TURN = IM_START + "assistant\n";

  static final String JSON_SUFFIX = " Respon estrictament en format JSON sense text addicional.";

  static final String JSON_SYSTEM_PROMPT =
      "Ets un assistent útil. Respon ÚNICAMENT amb JSON vàlid. No incloguis cap text fora del JSON.\n"
          + "- Si et demanen una LLISTA d'elements, respon amb un array JSON directament: "
          + "[\"element1\", \"element2\", \"element3\"]\n"
          + "- Si et demanen informació general, respon amb un objecte: {\"response\": \"la teva resposta\"}";

  static final String JSON_FEW_SHOT =
      turn("user", "Dona'm 3 colors primaris")
          + turn("assistant", "[\"vermell\", \"blau\", \"groc\"]")
          + turn("user", "Hola")
          + turn("assistant", "{\"response\": \"Hola! En què et puc ajudar?\"}");

  static final String ANTI_ECHO_INSTRUCTIONS =
      "\n\nINSTRUCCIONS IMPORTANTS:\n"
          + "- NO copiïs ni repeteixis el text d'entrada.\n"
          + "- GENERA contingut NOU i ORIGINAL basat en les dades proporcionades.\n"
          + "- EXPANDEIX i ELABORA la informació, no la repeteixis textualment.\n"
          + "- La teva resposta ha de ser DIFERENT del text que t'he proporcionat.";

  static final String DEFAULT_SYSTEM_PROMPT =
      "Ets un assistent útil que genera contingut original. NO copiïs el text d'entrada, genera una resposta nova.";

  private ChatMlPromptFormatter() {}

  public static String format(InvocationRequest request) {
    String systemPrompt = request.systemPrompt();
    StringBuilder prompt = new StringBuilder();
    if (request.jsonResponse()) {
      String system =
          StringUtils.hasText(systemPrompt) ? systemPrompt + JSON_SUFFIX : JSON_SYSTEM_PROMPT;
      prompt.append(IM_START).append("system\n").append(system).append(IM_END).append('\n');
      prompt.append(JSON_FEW_SHOT);
    } else if (StringUtils.hasText(systemPrompt)) {
      prompt.append(IM_START)
          .append("system\n")
          .append(systemPrompt)
          .append(ANTI_ECHO_INSTRUCTIONS)
          .append(IM_END)
          .append('\n');
    } else {
      prompt.append(IM_START).append("system\n").append(DEFAULT_SYSTEM_PROMPT).append(IM_END).append('\n');
    }
    prompt.append(IM_START).append("user\n").append(request.prompt()).append(IM_END).append('\n');
    prompt.append(ASSISTANT_TURN);
    return prompt.toString();
  }

  /**
   * Drops a prompt echoed back by the endpoint: everything up to the last assistant marker, and
   * a leading {@code Output:} label.
   */
  public static String stripEcho(String generated, String renderedPrompt) {
    if (generated == null) {
      return "";
    }
    String text = generated;
    String marker = IM_START + "assistant";
    int assistant = text.lastIndexOf(marker);
    if (assistant >= 0) {
      text = text.substring(assistant + marker.length());
      text = text.replaceFirst("(?i)^\\s*Output:\\s*", "");
    } else if (renderedPrompt != null && text.startsWith(renderedPrompt)) {
      text = text.substring(renderedPrompt.length());
    }
    int end = text.indexOf(IM_END);
    if (end >= 0) {
      text = text.substring(0, end);
    }
    return text.trim();
  }

  private static String turn(String role, String content) {
    return IM_START + role + "\n" + content + "\n" + IM_END + "\n";
  }
}
