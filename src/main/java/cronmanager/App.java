package cronmanager;

import cronmanager.cli.ManagerCommand;

public final class App {
    private App() {
    }

    public static void main(String[] args) {
        int code = ManagerCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}
