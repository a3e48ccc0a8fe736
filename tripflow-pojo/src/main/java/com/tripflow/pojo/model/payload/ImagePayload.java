package com.tripflow.pojo.model.payload;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class ImagePayload extends ProviderPayload {

    private List<ImageRef> images = new ArrayList<>();

    @Override
    public boolean isFullyLabelled() {
        return isEstimated() && images.stream().allMatch(ImageRef::isEstimated);
    }
}
