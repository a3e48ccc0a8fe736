package com.tripflow.pojo.model.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageRef {

    /** 图片对应的主题，例如目的地或兴趣点 */
    private String subject;

    private String url;

    private boolean estimated;
}
