package com.example.userload.client;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Random credentials for registration attempts. E-mails carry the attempt label plus a random
 * suffix so reruns against the same service do not collide.
 */
public class CredentialGenerator {

    static final String EMAIL_DOMAIN = "loadtest.com";
    static final int SUFFIX_LENGTH = 6;
    static final int PASSWORD_LENGTH = 12;

    private static final String SUFFIX_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final String PASSWORD_ALPHABET =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789!@#$%";

    public String email(String label) {
        return "user" + label + "_" + randomString(SUFFIX_ALPHABET, SUFFIX_LENGTH) + "@" + EMAIL_DOMAIN;
    }

    public String password() {
        return randomString(PASSWORD_ALPHABET, PASSWORD_LENGTH);
    }

    public String username(String label) {
        return "user" + label;
    }

    private static String randomString(String alphabet, int length) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return sb.toString();
    }
}
