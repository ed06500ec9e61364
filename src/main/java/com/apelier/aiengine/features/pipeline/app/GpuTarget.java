package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.features.gallery.domain.Photo;
import com.apelier.aiengine.features.storage.domain.StorageKeys;

/**
 * Source and destination keys for a single-image GPU edit: the latest version of the photo is read
 * and the result is written to its edited key.
 */
record GpuTarget(String imageKey, String outputKey) {
    
    static GpuTarget of(Photo photo) {
        if (photo.getEditedKey() != null) {
            return new GpuTarget(photo.getEditedKey(), photo.getEditedKey());
        }
        return new GpuTarget(photo.getOriginalKey(), StorageKeys.editedKeyFor(photo.getOriginalKey()));
    }
}
