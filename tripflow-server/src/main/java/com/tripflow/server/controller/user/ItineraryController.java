package com.tripflow.server.controller.user;

import com.tripflow.common.exception.BaseException;
import com.tripflow.common.result.ErrorCode;
import com.tripflow.common.result.Result;
import com.tripflow.pojo.dto.ReplanRequestDTO;
import com.tripflow.pojo.model.itinerary.ItineraryVersion;
import com.tripflow.server.replan.ReplanCoordinator;
import com.tripflow.server.service.ItineraryVersionService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/user/itinerary")
@RequiredArgsConstructor
public class ItineraryController {

    private final ItineraryVersionService itineraryVersionService;
    private final ReplanCoordinator replanCoordinator;

    /**
     * 查询行程版本（带缓存）。
     */
    @GetMapping("/version/{versionId}")
    public Result<ItineraryVersion> getVersion(@PathVariable("versionId") Long versionId) {
        ItineraryVersion version = itineraryVersionService.loadVersion(versionId);
        if (version == null) {
            throw new BaseException(ErrorCode.UNKNOWN_VERSION);
        }
        return Result.success(version);
    }

    @GetMapping("/{itineraryId}/versions")
    public Result<List<ItineraryVersion>> listVersions(@PathVariable("itineraryId") Long itineraryId) {
        return Result.success(itineraryVersionService.listVersions(itineraryId));
    }

    /**
     * 基于某个版本发起修改，返回重规划任务 ID。
     * 无法确定修改范围时返回 AMBIGUOUS_MODIFICATION，需要用户澄清。
     */
    @PostMapping("/version/{versionId}/replan")
    public Result<Long> replan(@PathVariable("versionId") Long versionId, @RequestBody ReplanRequestDTO dto) {
        return Result.success(replanCoordinator.replan(versionId, dto));
    }
}
