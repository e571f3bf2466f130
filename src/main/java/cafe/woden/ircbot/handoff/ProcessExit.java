package cafe.woden.ircbot.handoff;

/** Ends this process after an orderly shutdown of the application. */
public interface ProcessExit {

  void exit(int status);
}
