package com.apelier.aiengine.features.output.app;

import com.apelier.aiengine.common.config.PipelineProperties;
import com.apelier.aiengine.common.imaging.ImageMats;
import com.apelier.aiengine.common.imaging.OpenCvNatives;
import com.apelier.aiengine.features.output.domain.GeneratedOutputs;
import net.coobird.thumbnailator.Thumbnails;
import org.opencv.core.Mat;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Encodes the final delivery tiers: full resolution, web and thumbnail.
 * Sizes and JPEG qualities come from {@link PipelineProperties}; images are only ever scaled down.
 */
@Component
public class OutputGenerator {
    
    private final PipelineProperties.Tier full;
    private final PipelineProperties.Tier web;
    private final PipelineProperties.Tier thumbnail;
    
    public OutputGenerator(PipelineProperties properties) {
        OpenCvNatives.ensureLoaded();
        this.full = properties.getFull();
        this.web = properties.getWeb();
        this.thumbnail = properties.getThumbnail();
    }
    
    public GeneratedOutputs generate(Mat image) {
        BufferedImage source = ImageMats.toBufferedImage(image);
        
        BufferedImage fullImage = resize(source, full.getMaxPx());
        byte[] fullRes = encode(fullImage, full.getJpegQuality());
        byte[] webRes = encode(resize(source, web.getMaxPx()), web.getJpegQuality());
        byte[] thumb = encode(resize(source, thumbnail.getMaxPx()), thumbnail.getJpegQuality());
        
        return new GeneratedOutputs(fullRes, webRes, thumb, fullImage.getWidth(), fullImage.getHeight());
    }
    
    private static BufferedImage resize(BufferedImage source, int maxPx) {
        if (maxPx <= 0 || Math.max(source.getWidth(), source.getHeight()) <= maxPx) {
            return source;
        }
        try {
            return Thumbnails.of(source)
                    .size(maxPx, maxPx)
                    .keepAspectRatio(true)
                    .asBufferedImage();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to resize image to " + maxPx + "px", e);
        }
    }
    
    private static byte[] encode(BufferedImage image, int quality) {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try {
            Thumbnails.of(image)
                    .scale(1.0)
                    .outputFormat("jpg")
                    .outputQuality(quality / 100.0)
                    .toOutputStream(output);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode JPEG", e);
        }
        return output.toByteArray();
    }
}
