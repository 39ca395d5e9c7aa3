package com.trackerrelay.service.readme;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ReadmePatcher {
    private static final Pattern DATE_BADGE = Pattern.compile(
            "\\[!\\[Last update]\\(https://img\\.shields\\.io/badge/Last%20update-\\d{4}/\\d{2}/\\d{2}"
                    + "-%232ea043\\?style=flat-square&logo=github\\)]\\(#\\)"
    );
    private static final Pattern TRACKER_COUNT = Pattern.compile("All Tracker list &emsp; \\(\\d+ trackers\\)");

    private ReadmePatcher() {
    }

    public static String patch(String readme, String date, int count) {
        String badge = "[![Last update](https://img.shields.io/badge/Last%20update-" + date
                + "-%232ea043?style=flat-square&logo=github)](#)";
        String withDate = DATE_BADGE.matcher(readme).replaceAll(Matcher.quoteReplacement(badge));
        return TRACKER_COUNT.matcher(withDate)
                .replaceAll(Matcher.quoteReplacement("All Tracker list &emsp; (" + count + " trackers)"));
    }
}
