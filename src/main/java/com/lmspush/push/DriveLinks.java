package com.lmspush.push;

import com.lmspush.content.ContentValidationException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites shared drive links to direct-download links.
 */
public final class DriveLinks {

    private static final Pattern GOOGLE_FILE_ID = Pattern.compile("/d/([\\w-]+)");

    private DriveLinks() {
    }

    /**
     * Links that do not have the expected shape are returned unchanged.
     */
    public static String toDirectDownload(String url, DrivePlatform platform) {
        if (url == null || url.isBlank()) {
            throw new ContentValidationException("file_url is required");
        }
        if (platform == null) {
            throw new ContentValidationException("platform is required");
        }
        switch (platform) {
            case GOOGLE_DRIVE -> {
                Matcher matcher = GOOGLE_FILE_ID.matcher(url);
                if (matcher.find()) {
                    return "https://drive.google.com/uc?export=download&id=" + matcher.group(1);
                }
            }
            case ONE_DRIVE -> {
                if (!url.contains("download=1")) {
                    return url + (url.contains("?") ? "&" : "?") + "download=1";
                }
            }
        }
        return url;
    }
}
