package com.github.salilvnair.supportrouter.guard;

import com.github.salilvnair.supportrouter.config.SupportRouterProperties;
import com.github.salilvnair.supportrouter.util.TextNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans a remote model reply before a customer sees it: markup and model control tokens are
 * removed, lines that echo the prompt are dropped and the text is capped at
 * {@code supportrouter.remote-model.max-reply-length}. An empty result means the reply is unusable.
 */
@Component
public class ReplySanitizer {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Document.OutputSettings PLAIN_TEXT = new Document.OutputSettings().prettyPrint(false);

    private static final Pattern CONTROL_TOKENS = Pattern.compile("<\\|[a-z_]+\\|>|\\[/?inst]|<</?sys>>", FLAGS);
    private static final Pattern PROMPT_ECHO_LINE = Pattern.compile(
            "^[ \\t\\-*#>]*(?:(?:system ?prompt|instructions|instruktioner)\\s*:"
                    + "|(?:company facts|what we already know about the customer|recent conversation"
                    + "|customer message|answer only from the following|there is no knowledge base material"
                    + "|you are the customer support assistant)\\b).*(?:\\n|$)",
            FLAGS | Pattern.MULTILINE);
    private static final Pattern SELF_REFERENCE = Pattern.compile(
            "\\b(as an ai( language model)?|som en ai( ?-?språkmodell)?|i was told to|jag har blivit instruerad att)\\b[,:]?\\s*",
            FLAGS);
    private static final Pattern EXTRA_BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?](?=\\s|$)");

    private final int maxLength;

    public ReplySanitizer(SupportRouterProperties properties) {
        this.maxLength = Math.max(1, properties.getRemoteModel().getMaxReplyLength());
    }

    public String sanitize(String reply) {
        if (reply == null || reply.isBlank()) {
            return "";
        }
        String text = CONTROL_TOKENS.matcher(reply.replace("\r\n", "\n")).replaceAll("");
        text = Parser.unescapeEntities(Jsoup.clean(text, "", Safelist.none(), PLAIN_TEXT), false);
        text = PROMPT_ECHO_LINE.matcher(text).replaceAll("");
        text = SELF_REFERENCE.matcher(text).replaceAll("");
        text = EXTRA_BLANK_LINES.matcher(text).replaceAll("\n\n").trim();
        return cap(text);
    }

    private String cap(String text) {
        if (text.length() <= maxLength) {
            return text;
        }
        String head = text.substring(0, maxLength);
        int cut = -1;
        Matcher matcher = SENTENCE_END.matcher(head);
        while (matcher.find()) {
            cut = matcher.end();
        }
        // keep whole sentences unless that throws away more than half the reply
        if (cut >= maxLength / 2) {
            return head.substring(0, cut).trim();
        }
        return TextNormalizer.abbreviate(text, maxLength);
    }
}
