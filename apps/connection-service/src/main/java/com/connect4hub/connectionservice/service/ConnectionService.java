package com.connect4hub.connectionservice.service;

import com.connect4hub.connectionservice.domain.model.ConnectCommand;
import com.connect4hub.connectionservice.domain.model.ConnectionAccepted;

public interface ConnectionService {

    /**
     * 受理一次连接。无状态：不保存任何会话，同一身份重复调用互不影响。
     * @param command 已校验的连接命令
     * @return 受理结果
     */
    ConnectionAccepted connect(ConnectCommand command);
}
