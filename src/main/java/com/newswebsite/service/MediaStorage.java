package com.newswebsite.service;

import com.newswebsite.exception.MediaUploadException;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Remote object store for uploaded files.
 */
public interface MediaStorage {

    /**
     * Stores the bytes and returns their public URL.
     *
     * @throws MediaUploadException if the store rejects or cannot be reached
     */
    String upload(byte[] data, String filename, MediaKind kind);

    default String upload(MultipartFile file, MediaKind kind) {
        try {
            return upload(file.getBytes(), file.getOriginalFilename(), kind);
        } catch (IOException e) {
            throw new MediaUploadException(kind.getFailureMessage(), e);
        }
    }
}
