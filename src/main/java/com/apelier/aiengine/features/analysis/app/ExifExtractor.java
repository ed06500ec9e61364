package com.apelier.aiengine.features.analysis.app;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extracts the camera settings worth keeping from an image's EXIF block:
 * camera and lens, exposure triangle, timestamps, orientation and metering.
 */
@Component
public class ExifExtractor {
    
    private static final Logger log = LoggerFactory.getLogger(ExifExtractor.class);
    
    private static final Map<String, Integer> USEFUL_TAGS = new LinkedHashMap<>();
    
    static {
        USEFUL_TAGS.put("Make", ExifDirectoryBase.TAG_MAKE);
        USEFUL_TAGS.put("Model", ExifDirectoryBase.TAG_MODEL);
        USEFUL_TAGS.put("LensMake", ExifDirectoryBase.TAG_LENS_MAKE);
        USEFUL_TAGS.put("LensModel", ExifDirectoryBase.TAG_LENS_MODEL);
        USEFUL_TAGS.put("ISOSpeedRatings", ExifDirectoryBase.TAG_ISO_EQUIVALENT);
        USEFUL_TAGS.put("ExposureTime", ExifDirectoryBase.TAG_EXPOSURE_TIME);
        USEFUL_TAGS.put("FNumber", ExifDirectoryBase.TAG_FNUMBER);
        USEFUL_TAGS.put("FocalLength", ExifDirectoryBase.TAG_FOCAL_LENGTH);
        USEFUL_TAGS.put("DateTimeOriginal", ExifDirectoryBase.TAG_DATETIME_ORIGINAL);
        USEFUL_TAGS.put("DateTimeDigitized", ExifDirectoryBase.TAG_DATETIME_DIGITIZED);
        USEFUL_TAGS.put("DateTime", ExifDirectoryBase.TAG_DATETIME);
        USEFUL_TAGS.put("ImageWidth", ExifDirectoryBase.TAG_IMAGE_WIDTH);
        USEFUL_TAGS.put("ImageLength", ExifDirectoryBase.TAG_IMAGE_HEIGHT);
        USEFUL_TAGS.put("Orientation", ExifDirectoryBase.TAG_ORIENTATION);
        USEFUL_TAGS.put("Flash", ExifDirectoryBase.TAG_FLASH);
        USEFUL_TAGS.put("WhiteBalance", ExifDirectoryBase.TAG_WHITE_BALANCE_MODE);
        USEFUL_TAGS.put("ExposureProgram", ExifDirectoryBase.TAG_EXPOSURE_PROGRAM);
        USEFUL_TAGS.put("MeteringMode", ExifDirectoryBase.TAG_METERING_MODE);
        USEFUL_TAGS.put("ExposureBiasValue", ExifDirectoryBase.TAG_EXPOSURE_BIAS);
        USEFUL_TAGS.put("BrightnessValue", ExifDirectoryBase.TAG_BRIGHTNESS_VALUE);
    }
    
    /**
     * Returns the useful EXIF fields keyed by their EXIF name, with human-readable values.
     * Images without EXIF, or whose metadata cannot be parsed, yield an empty map.
     */
    public Map<String, String> extract(byte[] imageBytes) {
        Map<String, String> exif = new LinkedHashMap<>();
        
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(new ByteArrayInputStream(imageBytes));
            
            for (Directory directory : metadata.getDirectories()) {
                if (!(directory instanceof ExifIFD0Directory) && !(directory instanceof ExifSubIFDDirectory)) {
                    continue;
                }
                for (Map.Entry<String, Integer> tag : USEFUL_TAGS.entrySet()) {
                    if (exif.containsKey(tag.getKey()) || !directory.containsTag(tag.getValue())) {
                        continue;
                    }
                    String description = sanitizeString(directory.getDescription(tag.getValue()));
                    if (description != null && !description.isBlank()) {
                        exif.put(tag.getKey(), description);
                    }
                }
            }
            
        } catch (ImageProcessingException | IOException e) {
            // Expected for formats without a metadata block
            log.debug("Failed to extract EXIF data: {}", e.getMessage());
        }
        
        return exif;
    }
    
    /**
     * Remove null bytes, which PostgreSQL JSONB does not accept.
     */
    private String sanitizeString(String str) {
        if (str == null) {
            return null;
        }
        return str.replace("\u0000", "").trim();
    }
}
