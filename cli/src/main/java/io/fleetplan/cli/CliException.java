package io.fleetplan.cli;

/** Bad command line; reported with the usage text. */
final class CliException extends RuntimeException {
    CliException(String msg) {
        super(msg);
    }
}
