package com.tripflow.server.service;

import com.tripflow.pojo.dto.ChatTurnRequestDTO;
import com.tripflow.pojo.vo.ChatTurnVO;

public interface ConversationService {

    /**
     * 处理一轮用户输入：抽取槽位、合并上下文、追问缺失信息，槽位齐全且用户要求时发起生成。
     */
    ChatTurnVO handleTurn(ChatTurnRequestDTO request);
}
