package com.minidisc.common.source;

import com.minidisc.common.exception.AddressSourceException;
import com.minidisc.common.model.TailnetStatus;

/**
 * 私有网络地址来源
 * 返回本机地址以及当前在线的对端地址
 */
public interface AddressSource {

    /**
     * 读取当前网络状态
     *
     * @return 本机与在线对端地址
     * @throws AddressSourceException 无法获取状态
     */
    TailnetStatus status();
}
