package personal.ai.travel.booking.application.port.in;

/**
 * 커맨드 종류 (submitCommand의 kind)
 */
public enum CommandKind {
    BOOK,
    AMEND,
    CANCEL
}
