package com.github.salilvnair.portassist.entity;

public final class EntityKeyConstants {

    private EntityKeyConstants() {
    }

    public static final String BOOKING_REF = "booking_ref";
    public static final String CARRIER_ID = "carrier_id";
    public static final String TERMINAL = "terminal";
    public static final String GATE = "gate";
    public static final String DATE = "date";
    public static final String DATE_TODAY = "date_today";
    public static final String DATE_TOMORROW = "date_tomorrow";
    public static final String DATE_YESTERDAY = "date_yesterday";
    public static final String REQUESTED_TIME = "requested_time";
    public static final String PLATE = "plate";
}
