package com.lmspush.push;

import com.lmspush.content.ContentFixtures;
import com.lmspush.content.ContentValidationException;
import com.lmspush.content.Grade;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DriveLinksTest {

    @Test
    void googleDriveShareLink_becomesDirectDownload() {
        String shared = "https://drive.google.com/file/d/1AbC-dEf_123/view?usp=sharing";
        assertEquals("https://drive.google.com/uc?export=download&id=1AbC-dEf_123",
            DriveLinks.toDirectDownload(shared, DrivePlatform.GOOGLE_DRIVE));
    }

    @Test
    void googleDriveLinkWithoutFileId_isUnchanged() {
        String folder = "https://drive.google.com/drive/folders";
        assertEquals(folder, DriveLinks.toDirectDownload(folder, DrivePlatform.GOOGLE_DRIVE));
    }

    @Test
    void oneDriveLink_getsDownloadFlag() {
        assertEquals("https://1drv.ms/u/s!abc?download=1",
            DriveLinks.toDirectDownload("https://1drv.ms/u/s!abc", DrivePlatform.ONE_DRIVE));
        assertEquals("https://onedrive.live.com/view?id=1&download=1",
            DriveLinks.toDirectDownload("https://onedrive.live.com/view?id=1", DrivePlatform.ONE_DRIVE));
        assertEquals("https://onedrive.live.com/view?download=1",
            DriveLinks.toDirectDownload("https://onedrive.live.com/view?download=1", DrivePlatform.ONE_DRIVE));
    }

    @Test
    void missingUrlOrPlatform_isRejected() {
        assertThrows(ContentValidationException.class,
            () -> DriveLinks.toDirectDownload(" ", DrivePlatform.ONE_DRIVE));
        assertThrows(ContentValidationException.class,
            () -> DriveLinks.toDirectDownload("https://1drv.ms/u/s!abc", null));
    }

    @Test
    void drivePushRequest_replacesContentUrl() {
        DrivePushRequest request = new DrivePushRequest(
            "https://drive.google.com/file/d/XYZ/view", DrivePlatform.GOOGLE_DRIVE,
            ContentFixtures.essay(Grade.A), "main_lrs", true);

        PushRequest push = request.toPushRequest();

        assertEquals("https://drive.google.com/uc?export=download&id=XYZ", push.content().contentUrl());
        assertEquals("main_lrs", push.destination());
        assertTrue(push.forcePush());
    }

    @Test
    void platform_parsesWireValue() {
        assertEquals(DrivePlatform.GOOGLE_DRIVE, DrivePlatform.fromValue("google_drive"));
        assertEquals(DrivePlatform.ONE_DRIVE, DrivePlatform.fromValue("ONE_DRIVE"));
    }
}
