package com.dripline.backend.util;

import com.dripline.backend.enums.Channel;

/**
 * Masks recipient addresses before they reach the logs.
 */
public final class ContactMasking {

    private ContactMasking() {
    }

    public static String maskPhoneNumber(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.length() < 4) {
            return "****";
        }
        return phoneNumber.substring(0, Math.min(3, phoneNumber.length())) +
                "*".repeat(Math.max(0, phoneNumber.length() - 7)) +
                phoneNumber.substring(Math.max(3, phoneNumber.length() - 4));
    }

    public static String maskEmail(String email) {
        if (email == null) {
            return "****";
        }
        int at = email.indexOf('@');
        if (at <= 0) {
            return "****";
        }
        return email.charAt(0) + "***" + email.substring(at);
    }

    public static String mask(Channel channel, String address) {
        return channel == Channel.SMS ? maskPhoneNumber(address) : maskEmail(address);
    }
}
