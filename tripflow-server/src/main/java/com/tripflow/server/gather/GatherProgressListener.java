package com.tripflow.server.gather;

import com.tripflow.pojo.model.source.SourceResult;

/**
 * 每个数据源出结果时回调一次，resolved 从 1 递增到 total。
 */
@FunctionalInterface
public interface GatherProgressListener {

    GatherProgressListener NOOP = (result, resolved, total) -> {
    };

    void onSourceResolved(SourceResult result, int resolved, int total);
}
