package fr.lapetina.aiplatform.infrastructure.provider;

import fr.lapetina.aiplatform.domain.model.GeneratedImage;

import java.util.List;

public record ImageResult(List<GeneratedImage> images, String model) {

    public ImageResult {
        images = images != null ? List.copyOf(images) : List.of();
    }
}
