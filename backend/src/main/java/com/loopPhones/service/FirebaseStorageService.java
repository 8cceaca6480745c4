package com.loopPhones.service;

import com.google.cloud.storage.Bucket;
import com.google.firebase.cloud.StorageClient;
import com.loopPhones.exception.InvalidInputException;
import com.loopPhones.exception.ServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
public class FirebaseStorageService {

    private static final String GRADING_PREFIX = "grading/";
    private static final Set<String> ALLOWED_TYPES = Set.of("image/jpeg", "image/png", "image/webp");

    /** Stores a grading photo under grading/{deviceId}/ and returns its download URL */
    public String uploadGradingImage(String deviceId, MultipartFile file) {
        if (file.isEmpty() || file.getContentType() == null || !ALLOWED_TYPES.contains(file.getContentType())) {
            throw new InvalidInputException("Unsupported image: " + file.getOriginalFilename());
        }

        String fileName = GRADING_PREFIX + deviceId + "/" + generateFileName(file.getOriginalFilename());
        try {
            Bucket bucket = StorageClient.getInstance().bucket();
            bucket.create(fileName, file.getInputStream(), file.getContentType());
            log.info("Uploaded grading image {} ({} bytes)", fileName, file.getSize());
            return String.format("https://firebasestorage.googleapis.com/v0/b/%s/o/%s?alt=media",
                    bucket.getName(),
                    URLEncoder.encode(fileName, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ServiceException("Cannot upload image " + file.getOriginalFilename(), e);
        }
    }

    private String generateFileName(String originalFileName) {
        String extension = "";
        if (originalFileName != null && originalFileName.contains(".")) {
            extension = originalFileName.substring(originalFileName.lastIndexOf("."));
        }
        return UUID.randomUUID() + extension;
    }
}
