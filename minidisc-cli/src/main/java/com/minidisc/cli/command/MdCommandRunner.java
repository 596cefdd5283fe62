/**
 * md 命令分发
 *
 * @date 2026/10/17
 */
package com.minidisc.cli.command;

import com.minidisc.common.exception.MinidiscException;
import com.minidisc.common.exception.RegistryProtocolException;
import com.minidisc.common.model.AddrPort;
import com.minidisc.common.model.Service;
import com.minidisc.core.Minidisc;
import com.minidisc.core.Registry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * 执行 list / find / advertise / help 子命令
 *
 * 退出码：0 成功，1 运行失败，2 用法错误。
 */
@Slf4j
public class MdCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: md <command> [parameters]\n"
        + "\n"
        + "Available commands:\n"
        + "  list - Print a list of advertised services on the Tailnet.\n"
        + "  find <name> [key=val] ...  - Find a service, given name and labels.\n"
        + "  advertise <json file> - Read service config from JSON and advertise it.\n"
        + "  help - This page.\n";

    private final Minidisc minidisc;
    private final PrintStream out;
    private final PrintStream err;
    private final InputStream stdin;

    private int exitCode = EXIT_OK;

    public MdCommandRunner(Minidisc minidisc, PrintStream out, PrintStream err) {
        this(minidisc, out, err, System.in);
    }

    MdCommandRunner(Minidisc minidisc, PrintStream out, PrintStream err, InputStream stdin) {
        this.minidisc = minidisc;
        this.out = out;
        this.err = err;
        this.stdin = stdin;
    }

    @Override
    public void run(ApplicationArguments args) {
        // --minidisc.xxx 形式的参数由 Spring 绑定到配置，这里只处理子命令
        exitCode = execute(args.getNonOptionArgs());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(List<String> args) {
        if (args.isEmpty()) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        String command = args.get(0);
        List<String> params = args.subList(1, args.size());
        switch (command) {
            case "list":
                return list(params);
            case "find":
                return find(params);
            case "advertise":
                return advertise(params);
            case "help":
                err.println(USAGE);
                return EXIT_OK;
            default:
                err.printf("Unknown command '%s'%n%n", command);
                err.println(USAGE);
                return EXIT_USAGE;
        }
    }

    private int list(List<String> params) {
        if (!params.isEmpty()) {
            err.println("'list' doesn't take parameters");
            return EXIT_USAGE;
        }
        List<Service> services;
        try {
            services = minidisc.listServices();
        } catch (MinidiscException e) {
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }
        if (services.isEmpty()) {
            err.println("No advertised services found");
            return EXIT_OK;
        }
        out.print(ServiceTableFormatter.format(services));
        return EXIT_OK;
    }

    private int find(List<String> params) {
        if (params.isEmpty()) {
            err.println("'find' takes at least 1 parameter");
            return EXIT_USAGE;
        }
        String name = params.get(0);
        Map<String, String> labels = new LinkedHashMap<>();
        for (String param : params.subList(1, params.size())) {
            String[] parts = param.split("=", 2);
            if (parts.length != 2) {
                err.printf("Cannot parse label '%s'%n", param);
                return EXIT_USAGE;
            }
            labels.put(parts[0], parts[1]);
        }
        try {
            AddrPort addrPort = minidisc.findService(name, labels);
            out.println(addrPort);
            return EXIT_OK;
        } catch (MinidiscException e) {
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int advertise(List<String> params) {
        if (params.size() != 1) {
            err.println("'advertise' takes exactly 1 parameter");
            return EXIT_USAGE;
        }
        String path = params.get(0);
        List<Service> services;
        try {
            services = ServiceConfigLoader.load(path, stdin);
        } catch (IOException e) {
            err.printf("Can't read '%s': %s%n", path, e.getMessage());
            return EXIT_USAGE;
        } catch (RegistryProtocolException e) {
            err.printf("Error parsing config file: %s%n", e.getMessage());
            return EXIT_USAGE;
        }

        Registry registry;
        try {
            registry = minidisc.startRegistry();
            for (Service service : services) {
                AddrPort addrPort = service.getAddrPort();
                if (addrPort.getAddress().equals(registry.getLocalAddress())) {
                    registry.advertise(addrPort.getPort(), service.getName(), service.getLabels());
                } else {
                    registry.advertiseRemote(addrPort, service.getName(), service.getLabels());
                }
            }
        } catch (MinidiscException e) {
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }

        log.info("正在广播 {} 个服务，发送 SIGINT 停止...", services.size());
        try {
            // 进程收到 SIGINT 时 Spring 关闭 Minidisc，注册表随之终止
            registry.terminationFuture().join();
            return EXIT_OK;
        } catch (CompletionException e) {
            err.println(e.getCause().getMessage());
            return EXIT_FAILURE;
        }
    }
}
