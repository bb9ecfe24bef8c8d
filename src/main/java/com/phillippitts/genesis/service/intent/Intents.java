package com.phillippitts.genesis.service.intent;

/**
 * Intent and entity names shared by the resolver, the orchestrator, the planner and plugins.
 */
public final class Intents {

    public static final String TELL_TIME = "tell_time";
    public static final String TELL_DATE = "tell_date";
    public static final String SET_REMINDER = "set_reminder";
    public static final String CANCEL_REMINDER = "cancel_reminder";
    public static final String CHANGE_PERSONALITY = "change_personality";
    public static final String CHANGE_TONE = "change_tone";
    public static final String REMEMBER_FACT = "remember_fact";
    public static final String RECALL_FACT = "recall_fact";
    public static final String FORGET_FACT = "forget_fact";
    public static final String GENERAL_QUERY = "general_query";
    public static final String UNKNOWN = "unknown";

    public static final String ENTITY_PERSONA_NAME = "persona_name";
    public static final String ENTITY_TONE_NAME = "tone_name";
    public static final String ENTITY_NOTE = "note";
    public static final String ENTITY_TIME = "time_str";
    public static final String ENTITY_REMINDER_NAME = "reminder_name";
    public static final String ENTITY_FACT_KEY = "fact_key";
    public static final String ENTITY_FACT_VALUE = "fact_value";

    private Intents() {
    }
}
