package com.tripflow.server.controller.user;

import com.tripflow.common.exception.BaseException;
import com.tripflow.common.result.ErrorCode;
import com.tripflow.common.result.Result;
import com.tripflow.pojo.model.itinerary.ItineraryVersion;
import com.tripflow.server.replan.ReplanCoordinator;
import com.tripflow.server.service.ItineraryVersionService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

/**
 * ItineraryController 单元测试：
 * - 版本存在时原样返回；
 * - 版本不存在时抛出 UNKNOWN_VERSION，由全局异常处理器转换。
 */
@ExtendWith(MockitoExtension.class)
class ItineraryControllerTest {

    @Mock
    private ItineraryVersionService itineraryVersionService;

    @Mock
    private ReplanCoordinator replanCoordinator;

    @InjectMocks
    private ItineraryController itineraryController;

    @Test
    void existingVersionIsReturned() {
        ItineraryVersion version = ItineraryVersion.builder().versionId(7L).destination("Phuket").build();
        when(itineraryVersionService.loadVersion(7L)).thenReturn(version);

        Result<ItineraryVersion> result = itineraryController.getVersion(7L);

        assertSame(version, result.getData());
    }

    @Test
    void missingVersionIsUnknownVersion() {
        when(itineraryVersionService.loadVersion(8L)).thenReturn(null);

        BaseException ex = assertThrows(BaseException.class, () -> itineraryController.getVersion(8L));

        assertEquals(ErrorCode.UNKNOWN_VERSION, ex.getErrorCode());
    }
}
