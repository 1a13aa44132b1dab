package io.ontomesh;

import io.ontomesh.cli.OntoMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new OntoMeshCommand()).execute(args);
        System.exit(code);
    }
}
