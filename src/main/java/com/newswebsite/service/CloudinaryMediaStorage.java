package com.newswebsite.service;

import com.newswebsite.config.AppProperties;
import com.newswebsite.exception.MediaUploadException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Signed uploads to the Cloudinary REST API.
 */
@Service
public class CloudinaryMediaStorage implements MediaStorage {

    private static final Logger LOG = LogManager.getLogger(CloudinaryMediaStorage.class);

    private final AppProperties.Cloudinary cloudinary;
    private final RestTemplate restTemplate;

    @Autowired
    public CloudinaryMediaStorage(AppProperties appProperties) {
        this(appProperties, new RestTemplate());
    }

    CloudinaryMediaStorage(AppProperties appProperties, RestTemplate restTemplate) {
        this.cloudinary = appProperties.getCloudinary();
        this.restTemplate = restTemplate;
    }

    @Override
    public String upload(byte[] data, String filename, MediaKind kind) {
        if (Inputs.isBlank(cloudinary.getCloudName()) || Inputs.isBlank(cloudinary.getApiKey())
                || Inputs.isBlank(cloudinary.getApiSecret())) {
            throw new MediaUploadException(kind.getFailureMessage(), "Cloudinary credentials are not configured");
        }

        long timestamp = System.currentTimeMillis() / 1000;
        String url = cloudinary.getUploadUrl() + "/" + cloudinary.getCloudName() + "/" + kind.getResourceType() + "/upload";

        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("file", new ByteArrayResource(data) {
            @Override
            public String getFilename() {
                return filename != null ? filename : "upload";
            }
        });
        form.add("api_key", cloudinary.getApiKey());
        form.add("timestamp", String.valueOf(timestamp));
        form.add("folder", kind.getFolder());
        form.add("signature", sign(kind.getFolder(), timestamp));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        try {
            ResponseEntity<Map> response = restTemplate.postForEntity(url, new HttpEntity<>(form, headers), Map.class);
            Map<String, Object> body = response.getBody();
            Object secureUrl = body != null ? body.get("secure_url") : null;
            if (secureUrl == null) {
                throw new MediaUploadException(kind.getFailureMessage(), "Upload response carried no secure_url");
            }
            LOG.info("Uploaded {} ({} bytes) to folder {}", kind, data.length, kind.getFolder());
            return secureUrl.toString();
        } catch (RestClientException e) {
            LOG.error("Cloudinary upload failed for {}", kind, e);
            throw new MediaUploadException(kind.getFailureMessage(), e);
        }
    }

    /**
     * Parameters sorted by name, joined as a query string, suffixed with the secret, SHA-1 hex.
     */
    String sign(String folder, long timestamp) {
        String toSign = "folder=" + folder + "&timestamp=" + timestamp + cloudinary.getApiSecret();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(toSign.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 algorithm not available", e);
        }
    }
}
