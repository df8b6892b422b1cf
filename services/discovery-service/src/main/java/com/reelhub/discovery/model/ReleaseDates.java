package com.reelhub.discovery.model;

public final class ReleaseDates {
    private ReleaseDates() {
    }

    public static Integer year(String date) {
        if (date == null || date.length() < 4) {
            return null;
        }
        try {
            return Integer.parseInt(date.substring(0, 4));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Integer decade(String date) {
        Integer year = year(date);
        return year == null ? null : (year / 10) * 10;
    }
}
