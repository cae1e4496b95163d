package com.phillippitts.huevoice.service.feedback;

import java.util.Locale;

/** Operating system family, used to pick feedback helper commands. */
enum Platform {
    MAC,
    LINUX,
    OTHER;

    static Platform current() {
        return from(System.getProperty("os.name", ""));
    }

    static Platform from(String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac")) {
            return MAC;
        }
        if (os.contains("linux")) {
            return LINUX;
        }
        return OTHER;
    }
}
