package com.ocreval.core.dataset;

import com.ocreval.common.dto.GroundTruthRecord;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * 数据集中的一条标注及其对应的图片文件。
 */
@Value
@Builder
public class DatasetEntry {

    /** 图片相对图片根目录的路径（/ 分隔），作为数据集内的唯一键 */
    String key;

    /** 标注文件所在目录相对图片根目录的路径，根目录本身为 "." */
    String directory;

    GroundTruthRecord groundTruth;

    Path imageFile;
}
