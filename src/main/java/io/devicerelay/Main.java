package io.devicerelay;

import io.devicerelay.cli.DeviceRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new DeviceRelayCommand()).execute(args);
        System.exit(code);
    }
}
