package com.lmspush.push;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lmspush.content.ContentRecord;

/**
 * Push request whose content lives behind a shared drive link.
 */
public record DrivePushRequest(
    @JsonProperty("file_url") String fileUrl,
    @JsonProperty("platform") DrivePlatform platform,
    @JsonProperty("content") ContentRecord content,
    @JsonProperty("destination") String destination,
    @JsonProperty("force_push") boolean forcePush
) {

    /**
     * The equivalent push request, with the content's location replaced by the
     * direct-download form of {@code fileUrl}.
     */
    public PushRequest toPushRequest() {
        ContentRecord resolved = content == null
            ? null
            : content.withContentUrl(DriveLinks.toDirectDownload(fileUrl, platform));
        return new PushRequest(resolved, destination, forcePush);
    }
}
