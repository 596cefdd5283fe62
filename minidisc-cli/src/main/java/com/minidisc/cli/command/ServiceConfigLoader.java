/**
 * 服务配置文件读取
 *
 * @date 2026/10/17
 */
package com.minidisc.cli.command;

import com.minidisc.common.codec.ServiceJsonCodec;
import com.minidisc.common.model.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 读取与 /services 响应相同格式的 JSON 数组，路径为 "-" 时读取标准输入
 */
public final class ServiceConfigLoader {

    public static final String STDIN = "-";

    private ServiceConfigLoader() {
    }

    /**
     * @throws IOException 文件无法读取
     * @throws com.minidisc.common.exception.RegistryProtocolException 内容无法解析
     */
    public static List<Service> load(String path, InputStream stdin) throws IOException {
        byte[] data = STDIN.equals(path) ? stdin.readAllBytes() : Files.readAllBytes(Path.of(path));
        return ServiceJsonCodec.decodeServices(data);
    }
}
