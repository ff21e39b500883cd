package com.github.salilvnair.portassist.support;

public final class TestConstants {

    private TestConstants() {
    }

    public static final String USER_TEXT_BOOKING_STATUS = "What's the status of REF123?";
    public static final String USER_TEXT_AVAILABILITY = "Is there availability tomorrow at Terminal A?";
    public static final String USER_TEXT_CARRIER_SCORE = "What's the score for carrier 123?";
    public static final String USER_TEXT_PASSAGES = "Show yesterday's truck passages";
    public static final String USER_TEXT_FOLLOW_UP = "and yesterday?";
    public static final String USER_TEXT_ANOMALY = "Are there any unusual delays at terminal A?";
    public static final String USER_TEXT_HELP = "help";
    public static final String USER_TEXT_THANKS = "thanks!";
    public static final String USER_TEXT_GIBBERISH = "xyz qwerty";

    public static final String BOOKING_REF = "REF123";
    public static final String CARRIER_ID = "123";
    public static final String OTHER_CARRIER_ID = "999";
    public static final String USER_ID = "user-42";
    public static final String TRACE_ID = "trace-0001-abcdef";
    public static final String AUTH_HEADER = "Bearer test-token";

    public static final String ROLE_CARRIER = "carrier";
    public static final String ROLE_ADMIN = "ADMIN";
    public static final String ROLE_OPERATOR = "operator";

    public static final String HANDLER_BOOKING = "booking";
    public static final String HANDLER_CARRIER_SCORE = "carrier-score";
    public static final String HANDLER_SLOT = "slot";
    public static final String HANDLER_ANOMALY = "anomaly";

    public static final String FIXED_INSTANT = "2026-03-10T08:30:00Z";
    public static final String BOOM = "boom";
    public static final String BACKEND_URL = "http://booking-svc:8080/internal/bookings";
}
