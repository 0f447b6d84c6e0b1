package com.walkierelay.server.http;

import com.walkierelay.server.lifecycle.EventLoop;
import com.walkierelay.server.media.MediaStore;
import com.walkierelay.server.relay.MediaRelay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.io.IOException;
import java.io.InputStream;

/**
 * Stores an uploaded clip and announces it to the channel as {@code audio-message}.
 */
@RestController
public class AudioUploadController {
    private static final Logger log = LoggerFactory.getLogger(AudioUploadController.class);

    private final MediaStore media;
    private final MediaRelay relay;
    private final EventLoop loop;

    public AudioUploadController(MediaStore media, MediaRelay relay, EventLoop loop) {
        this.media = media;
        this.relay = relay;
        this.loop = loop;
    }

    @PostMapping("/upload-audio")
    public UploadResponse upload(@RequestParam(value = "audio", required = false) MultipartFile audio,
                                 @RequestParam(value = "channelId", required = false) String channelId,
                                 @RequestParam(value = "userId", required = false) String userId) throws IOException {
        if (audio == null || audio.isEmpty()) {
            throw new UploadRejectedException("No audio file provided");
        }
        if (channelId == null || channelId.isBlank()) {
            throw new UploadRejectedException("channelId is required");
        }

        String filename;
        try (InputStream in = audio.getInputStream()) {
            filename = media.store(in);
        }
        String audioUrl = "/audio/" + filename;
        String publicUrl = ServletUriComponentsBuilder.fromCurrentContextPath().path(audioUrl).toUriString();
        log.info("[UPLOAD] {} bytes by {} for channel={} -> {}", audio.getSize(), userId, channelId, filename);

        loop.execute("upload-announce", () -> relay.announceUpload(channelId, userId, publicUrl));
        return new UploadResponse(true, audioUrl, filename);
    }

    public static class UploadResponse {
        public final boolean success;
        public final String audioUrl;
        public final String filename;

        UploadResponse(boolean success, String audioUrl, String filename) {
            this.success = success;
            this.audioUrl = audioUrl;
            this.filename = filename;
        }
    }
}
