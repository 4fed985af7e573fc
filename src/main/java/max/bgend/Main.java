package max.bgend;

import max.bgend.engine.cli.CommandRunner;

public class Main {
    public static void main(String[] args) {
        int status = new CommandRunner(System.out, System.err).run(args);
        if (status != CommandRunner.EXIT_OK) {
            System.exit(status);
        }
    }
}
