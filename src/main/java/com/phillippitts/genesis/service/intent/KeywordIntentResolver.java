package com.phillippitts.genesis.service.intent;

import com.phillippitts.genesis.domain.IntentResult;
import com.phillippitts.genesis.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default intent resolver built from ordered regular-expression rules. First matching rule wins.
 *
 * <p>Patterns match the utterance with trailing punctuation removed, case-insensitively; entity
 * values keep the speaker's original casing. Questions that match no rule resolve to
 * {@link Intents#GENERAL_QUERY}, everything else to {@link Intents#UNKNOWN}.
 */
public class KeywordIntentResolver implements IntentResolver {

    private static final Logger LOG = LogManager.getLogger(KeywordIntentResolver.class);

    private static final String TIME = "(\\d{1,2}:\\d{2})";
    private static final String WORD = "([\\w-]+)";

    private static final List<Rule> RULES = List.of(
            rule(Intents.CANCEL_REMINDER,
                    "^(?:please\\s+)?(?:cancel|delete|remove)\\s+(?:the\\s+|my\\s+)?reminder\\s+(?:to\\s+|about\\s+)?(.+?)\\s+at\\s+" + TIME + "$",
                    Intents.ENTITY_NOTE, Intents.ENTITY_TIME),
            rule(Intents.SET_REMINDER,
                    "\\bremind me\\s+(?:to\\s+)?(.+?)\\s+at\\s+" + TIME + "\\b",
                    Intents.ENTITY_NOTE, Intents.ENTITY_TIME),
            rule(Intents.SET_REMINDER,
                    "\\bset\\s+(?:a\\s+)?reminder\\s+(?:to\\s+|for\\s+)?(.+?)\\s+at\\s+" + TIME + "\\b",
                    Intents.ENTITY_NOTE, Intents.ENTITY_TIME),
            rule(Intents.SET_REMINDER, "\\bremind me\\s+(?:to\\s+)?(.+)$", Intents.ENTITY_NOTE),
            rule(Intents.SET_REMINDER, "\\bset\\s+(?:a\\s+)?reminder\\b"),
            rule(Intents.TELL_TIME,
                    "\\bwhat(?:'s|\\s+is)?\\s+(?:the\\s+)?time\\b|\\bwhat time\\b|\\bcurrent time\\b|\\btell me the time\\b"),
            rule(Intents.TELL_DATE,
                    "\\bwhat(?:'s|\\s+is)?\\s+(?:the\\s+|today's\\s+)?date\\b|\\bwhat day is (?:it|today)\\b|\\btoday's date\\b"),
            rule(Intents.CHANGE_PERSONALITY,
                    "\\b(?:switch|change)\\s+(?:your\\s+)?(?:personality|persona)\\s+to\\s+" + WORD,
                    Intents.ENTITY_PERSONA_NAME),
            rule(Intents.CHANGE_PERSONALITY,
                    "\\b(?:switch|change)\\s+to\\s+(?:the\\s+)?" + WORD + "\\s+(?:personality|persona)\\b",
                    Intents.ENTITY_PERSONA_NAME),
            rule(Intents.CHANGE_TONE,
                    "\\b(?:change|set|switch)\\s+(?:your\\s+)?tone\\s+to\\s+(?:an?\\s+)?" + WORD,
                    Intents.ENTITY_TONE_NAME),
            rule(Intents.CHANGE_TONE,
                    "\\b(?:use|adopt|speak\\s+(?:in|with))\\s+(?:an?\\s+)?" + WORD + "\\s+tone\\b",
                    Intents.ENTITY_TONE_NAME),
            rule(Intents.CHANGE_TONE, "\\b(?:change|set|switch)\\s+(?:your\\s+)?tone\\b"),
            rule(Intents.FORGET_FACT, "^forget\\s+(?:about\\s+)?(?:my\\s+)?(.+)$", Intents.ENTITY_FACT_KEY),
            rule(Intents.REMEMBER_FACT,
                    "^remember\\s+(?:that\\s+)?(?:my\\s+)?(.+?)\\s+is\\s+(.+)$",
                    Intents.ENTITY_FACT_KEY, Intents.ENTITY_FACT_VALUE),
            rule(Intents.RECALL_FACT, "^what(?:'s|\\s+is)\\s+my\\s+(.+)$", Intents.ENTITY_FACT_KEY),
            rule(Intents.RECALL_FACT, "^do you remember my\\s+(.+)$", Intents.ENTITY_FACT_KEY)
    );

    private static final Pattern QUESTION_START = Pattern.compile(
            "^(?:what|who|why|how|when|where|which|can|could|would|tell|explain|do|does|is|are)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.!?]+$");

    @Override
    public IntentResult resolve(String text) {
        String original = text == null ? "" : text;
        String body = TRAILING_PUNCTUATION.matcher(original.trim()).replaceAll("").trim();
        if (body.isEmpty()) {
            return IntentResult.of(Intents.UNKNOWN, original);
        }
        for (Rule rule : RULES) {
            Matcher m = rule.pattern().matcher(body);
            if (m.find()) {
                IntentResult result = new IntentResult(rule.intent(), extractEntities(rule, m), original);
                LOG.debug("Resolved '{}' to {} {}", LogSanitizer.truncate(body, LogSanitizer.PREVIEW_CHARS),
                        result.intent(), result.entities().keySet());
                return result;
            }
        }
        boolean question = original.trim().endsWith("?") || QUESTION_START.matcher(body).find();
        return IntentResult.of(question ? Intents.GENERAL_QUERY : Intents.UNKNOWN, original);
    }

    private static Map<String, Object> extractEntities(Rule rule, Matcher m) {
        Map<String, Object> entities = new LinkedHashMap<>();
        for (int i = 0; i < rule.entityNames().size() && i < m.groupCount(); i++) {
            String value = m.group(i + 1);
            if (value != null && !value.isBlank()) {
                entities.put(rule.entityNames().get(i), value.trim());
            }
        }
        return entities;
    }

    private static Rule rule(String intent, String regex, String... entityNames) {
        return new Rule(intent, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), List.of(entityNames));
    }

    private record Rule(String intent, Pattern pattern, List<String> entityNames) {
    }
}
