package ch.so.agi.gretllog.logging;

/**
 * Core logging contract that abstracts over the concrete destination (console,
 * {@code java.util.logging}, SLF4J, event listeners, ...).
 * <p>
 * Every severity offers four call shapes:
 * <ul>
 *   <li>{@code info(msg)} &ndash; plain message.</li>
 *   <li>{@code info(pattern, args...)} &ndash; message built with
 *       {@link String#format(java.util.Locale, String, Object...)}.</li>
 *   <li>{@code info(msg, thrown)} &ndash; message with exception details
 *       appended.</li>
 *   <li>{@code info(pattern, thrown, args...)} &ndash; both of the above.</li>
 * </ul>
 * A logger is also a node of a chain: every call is first handled by this
 * logger according to its own minimum level and then forwarded to the next
 * logger, which applies its own level independently. The chain never contains
 * the same logger twice.
 */
public interface Logger {

    public void trace(String msg);

    public void trace(String pattern, Object... args);

    public void trace(String msg, Throwable thrown);

    public void trace(String pattern, Throwable thrown, Object... args);

    public void debug(String msg);

    public void debug(String pattern, Object... args);

    public void debug(String msg, Throwable thrown);

    public void debug(String pattern, Throwable thrown, Object... args);

    public void info(String msg);

    public void info(String pattern, Object... args);

    public void info(String msg, Throwable thrown);

    public void info(String pattern, Throwable thrown, Object... args);

    public void warn(String msg);

    public void warn(String pattern, Object... args);

    public void warn(String msg, Throwable thrown);

    public void warn(String pattern, Throwable thrown, Object... args);

    public void error(String msg);

    public void error(String pattern, Object... args);

    public void error(String msg, Throwable thrown);

    public void error(String pattern, Throwable thrown, Object... args);

    public void fatal(String msg);

    public void fatal(String pattern, Object... args);

    public void fatal(String msg, Throwable thrown);

    public void fatal(String pattern, Throwable thrown, Object... args);

    /**
     * Dispatches an already formatted message at the given level. Equivalent to
     * calling the matching leveled method with a plain message.
     *
     * @param level severity of the message
     * @param msg   formatted message
     */
    public void log(Level level, String msg);

    public boolean isTraceEnabled();

    public boolean isDebugEnabled();

    public boolean isInfoEnabled();

    public boolean isWarnEnabled();

    public boolean isErrorEnabled();

    public boolean isFatalEnabled();

    public void setLevel(Level level);

    public Level getLevel();

    /**
     * @return the hierarchical, dot separated name of this logger; empty for the
     *         root logger
     */
    public String getName();

    /**
     * Returns the name shortened to at most {@code width} characters by
     * abbreviating the leading segments, e.g.
     * {@code c.s.a.g.LoggerFactory}.
     *
     * @param width maximum length of the result
     * @return abbreviated name
     */
    public String getAbbreviatedName(int width);

    public Logger getNext();

    public void setNext(Logger next);

    /**
     * Appends a logger at the end of this chain. If the logger is already part
     * of the chain nothing changes.
     *
     * @param logger the logger to append; {@code null} is ignored
     * @return {@code logger}, to allow fluent chaining
     */
    public Logger addToChain(Logger logger);

    /**
     * Removes a logger from this chain and reconnects its successor to its
     * predecessor.
     *
     * @param logger the logger to remove
     * @return {@code true} if the logger was part of the chain
     */
    public boolean removeFromChain(Logger logger);

    /**
     * @return number of loggers in this chain, including this logger
     */
    public int getChainCount();

    /**
     * Detaches this logger from its successor. Downstream links are kept.
     */
    public void clearChain();
}
