package com.tripflow.server.controller.user;

import com.tripflow.common.result.Result;
import com.tripflow.pojo.dto.ChatTurnRequestDTO;
import com.tripflow.pojo.vo.ChatTurnVO;
import com.tripflow.server.service.ConversationService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/user/chat")
@RequiredArgsConstructor
public class ChatController {

    private final ConversationService conversationService;

    /**
     * 提交一轮对话。槽位齐全且用户要求生成时，返回体中带 taskId。
     */
    @PostMapping("/turn")
    public Result<ChatTurnVO> turn(@RequestBody ChatTurnRequestDTO dto) {
        return Result.success(conversationService.handleTurn(dto));
    }
}
