/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.log4j.Log4j2;
import org.querypipe.data.Tuple;
import org.querypipe.planner.physical.PhysicalOperatorNode;

/**
 * The lifecycle every operator shares: the run-once guard, the producer/consumer loop, stop and
 * completion signalling, batching and phase timing.
 *
 * <p>A consumer runs in its own worker and forks its input. It receives items until the input
 * ends, it is stopped, or {@link #processItem} asks for no more; it then stops its input, calls
 * {@link #afterItems}, signals its parent and closes its exchange. A serialized consumer has no
 * worker of its own: its producer calls {@link #processItem} directly and closes it when done.
 *
 * <p>State transitions happen under the state lock. {@link #done} and {@link #reopen} wait until
 * no worker is running the operator.
 */
@Log4j2
public abstract class BaseOperator implements Operator {

  @Getter private final PhysicalOperatorNode plan;

  protected final ExecutionContext context;

  private final ValueExchange exchange;
  private final long quota;

  @Getter @Setter private Operator input;
  @Getter @Setter private Operator output;
  @Getter @Setter private Operator stop;
  @Getter @Setter private Operator parent;
  @Getter private int bit;
  private boolean root;

  private final boolean serializable;

  /** Consumes in its producer's worker. */
  private boolean serialized;

  /** Hands its items directly to a serialized output. */
  private boolean sendsSerialized;

  /** Runs in the worker that forks it. */
  private final boolean inline;

  private final AtomicBoolean once = new AtomicBoolean();
  private final AtomicBoolean parentNotified = new AtomicBoolean();
  private final ReentrantLock stateLock = new ReentrantLock();
  private final Condition stateChanged = stateLock.newCondition();
  private OperatorState state = OperatorState.CREATED;

  private final AtomicLong execTime = new AtomicLong();
  private final AtomicLong chanTime = new AtomicLong();
  private final AtomicLong servTime = new AtomicLong();
  private final AtomicLong inDocs = new AtomicLong();
  private final AtomicLong outDocs = new AtomicLong();
  private final AtomicLong phaseSwitches = new AtomicLong();
  private Phase phase = Phase.NOTIME;
  private long phaseStart;

  protected List<Tuple> batch;

  protected BaseOperator(PhysicalOperatorNode plan, ExecutionContext context) {
    this(plan, context, false, false);
  }

  protected BaseOperator(
      PhysicalOperatorNode plan, ExecutionContext context, boolean serializable, boolean inline) {
    this.plan = plan;
    this.context = context;
    this.serializable = serializable;
    this.inline = inline;
    this.exchange = new ValueExchange(context.getPipelineCap());
    this.quota = context.useRequestQuota() ? context.producerThrottleQuota() : 0;
    this.output = this;
  }

  /** A fresh operator with the links of {@code other}; an output to itself stays to itself. */
  protected BaseOperator(BaseOperator other) {
    this.plan = other.plan;
    this.context = other.context;
    this.serializable = other.serializable;
    this.inline = other.inline;
    this.exchange = new ValueExchange(other.exchange.capacity());
    this.quota = other.quota;
    this.input = other.input;
    this.output = other.output == other ? this : other.output;
    this.stop = other.stop;
    this.parent = other.parent;
    this.bit = other.bit;
  }

  // hooks

  /**
   * Called once before any item is received.
   *
   * @return false to end the operator without reading its input
   */
  protected boolean beforeItems(ExecutionContext context, Tuple parent) {
    return true;
  }

  /**
   * Handles one input item.
   *
   * @return false to stop receiving items
   */
  protected boolean processItem(Tuple item, ExecutionContext context) {
    return sendItem(item);
  }

  /** Called once after the last item, also when the operator was stopped. */
  protected void afterItems(ExecutionContext context) {}

  /** Resets operator specific state for another run. */
  protected void resetState() {}

  /** The phase this operator counts towards in the request summary, or null. */
  protected ExecutionPhase executionPhase() {
    return null;
  }

  /** Bytes of memory the operator currently holds, shown in its profile. */
  protected long usedMemory() {
    return 0;
  }

  /**
   * Produces the operator's items. Forks the input and processes what it sends; operators without
   * input override this to generate their items.
   */
  protected void runItems(ExecutionContext context, Tuple parent) {
    if (input == null) {
      return;
    }
    fork(input, context, parent);
    ValueExchange source = input.getValueExchange();
    while (true) {
      Tuple item = getItem(source);
      if (item == null) {
        return;
      }
      inDocs.incrementAndGet();
      if (!processItem(item, context)) {
        return;
      }
    }
  }

  // run

  @Override
  public void runOnce(ExecutionContext context, Tuple parent) {
    runConsumer(context, parent);
  }

  /** Claims the single run of the current activation. */
  protected final boolean claimRun() {
    return once.compareAndSet(false, true);
  }

  protected final void runConsumer(ExecutionContext context, Tuple parent) {
    if (!claimRun()) {
      return;
    }
    try {
      boolean active = active();
      ExecutionPhase executionPhase = executionPhase();
      if (active && executionPhase != null) {
        context.addPhaseOperator(executionPhase);
      }
      switchPhase(Phase.EXEC);

      if (serialized) {
        if (active && beforeItems(context, parent)) {
          // the producer calls back into this operator and closes it when it ends
          input.runOnce(context, parent);
        } else {
          notifyStop();
          notifyParent();
          close(context);
        }
        return;
      }

      if (active && beforeItems(context, parent)) {
        runItems(context, parent);
        notifyStop();
        afterItems(context);
      } else {
        notifyStop();
      }
      releaseBatch();
      notifyParent();
      close(context);
    } catch (Throwable t) {
      context.recover(this, t);
    } finally {
      switchPhase(Phase.NOTIME);
    }
  }

  /** Runs {@code op} in a new worker, or in this one if it is inline. */
  protected void fork(Operator op, ExecutionContext context, Tuple parent) {
    if (op instanceof BaseOperator && ((BaseOperator) op).inline) {
      op.runOnce(context, parent);
      return;
    }
    context.getExecutor().execute(() -> op.runOnce(context, parent));
  }

  // items

  /**
   * Sends an item to the output.
   *
   * @return false if the output wants no more items
   */
  protected boolean sendItem(Tuple item) {
    if (exchange.isStopped()) {
      item.recycle();
      return false;
    }
    if (sendsSerialized) {
      outDocs.incrementAndGet();
      return ((BaseOperator) output).serializedSend(item);
    }
    switchPhase(Phase.CHAN);
    boolean ok = exchange.sendItem(output.getValueExchange(), item, quota);
    switchPhase(Phase.EXEC);
    if (ok) {
      outDocs.incrementAndGet();
    } else {
      item.recycle();
    }
    return ok;
  }

  /** Receives the next item from {@code source}; null at the end of the input or on a stop. */
  protected Tuple getItem(ValueExchange source) {
    switchPhase(Phase.CHAN);
    Tuple item = exchange.getItem(source);
    switchPhase(Phase.EXEC);
    return item;
  }

  private boolean serializedSend(Tuple item) {
    inDocs.incrementAndGet();
    switchPhase(Phase.EXEC);
    boolean ok = processItem(item, context);
    switchPhase(Phase.NOTIME);
    return ok;
  }

  private void serializedClose(ExecutionContext context) {
    switchPhase(Phase.EXEC);
    try {
      if (exchange.isStopped()) {
        notifyStop();
      }
      afterItems(context);
      releaseBatch();
      notifyParent();
      close(context);
    } finally {
      switchPhase(Phase.NOTIME);
    }
  }

  @Override
  public boolean serializeOutput(Operator consumer, ExecutionContext context) {
    BaseOperator next = (BaseOperator) consumer;
    this.output = next;
    this.sendsSerialized = true;
    next.serialized = true;
    next.setInput(this);
    next.setStop(this);
    return true;
  }

  @Override
  public boolean isSerializable() {
    return serializable;
  }

  @Override
  public ValueExchange getValueExchange() {
    return exchange;
  }

  @Override
  public void setBit(int bit) {
    this.bit = bit;
  }

  @Override
  public void setRoot() {
    this.root = true;
  }

  protected boolean isRoot() {
    return root;
  }

  /** True once a stop has been requested. */
  protected boolean isStopped() {
    return exchange.isStopped();
  }

  // batching

  /**
   * Adds an item to the current batch, flushing it first if it is full.
   *
   * @return false if the flush failed
   */
  protected boolean enbatch(Tuple item, ExecutionContext context) {
    if (batch == null) {
      batch = context.getPools().getBatchPool().get();
    } else if (batch.size() >= context.getPools().batchSize()) {
      if (!flushBatch(context)) {
        item.recycle();
        return false;
      }
    }
    batch.add(item);
    return true;
  }

  /** Processes and empties the current batch. */
  protected boolean flushBatch(ExecutionContext context) {
    if (batch != null) {
      batch.clear();
    }
    return true;
  }

  protected void releaseBatch() {
    if (batch != null) {
      context.getPools().getBatchPool().put(batch);
      batch = null;
    }
  }

  // signals

  /** Tells the stop operator that no more input is wanted. */
  protected void notifyStop() {
    Operator target = stop;
    if (target == null) {
      return;
    }
    OperatorState current = getState();
    target.sendAction(
        current == OperatorState.RUNNING || current == OperatorState.COMPLETED
            ? OperatorAction.PAUSE
            : OperatorAction.STOP);
  }

  /** Signals completion to the parent, once per run. */
  protected void notifyParent() {
    Operator target = parent;
    if (target != null && parentNotified.compareAndSet(false, true)) {
      target.getValueExchange().sendChild(bit);
    }
  }

  /**
   * Waits for {@code count} child completion signals.
   *
   * @return the number received before a stop arrived
   */
  protected int childrenWait(int count) {
    int received = 0;
    while (received < count) {
      switchPhase(Phase.CHAN);
      int child = exchange.retrieveChild();
      switchPhase(Phase.EXEC);
      if (child == ValueExchange.NO_CHILD) {
        break;
      }
      received++;
    }
    return received;
  }

  /** Waits for {@code count} child completion signals, ignoring stops. */
  protected void childrenWaitNoStop(int count) {
    for (int i = 0; i < count; i++) {
      switchPhase(Phase.CHAN);
      exchange.retrieveChildNoStop();
      switchPhase(Phase.EXEC);
    }
  }

  // lifecycle

  /** Moves a created operator to running; false if it was stopped or paused first. */
  protected final boolean active() {
    stateLock.lock();
    try {
      if (state == OperatorState.CREATED) {
        state = OperatorState.RUNNING;
        stateChanged.signalAll();
        return true;
      }
      return false;
    } finally {
      stateLock.unlock();
    }
  }

  protected final void inactive() {
    stateLock.lock();
    try {
      if (state == OperatorState.RUNNING) {
        state = OperatorState.COMPLETED;
      } else if (state == OperatorState.STOPPING || state == OperatorState.PAUSED) {
        state = OperatorState.STOPPED;
      }
      stateChanged.signalAll();
    } finally {
      stateLock.unlock();
    }
  }

  /** Ends the run: closes the exchange and any serialized output, then marks completion. */
  protected void close(ExecutionContext context) {
    exchange.close();
    if (sendsSerialized) {
      ((BaseOperator) output).serializedClose(context);
    }
    inactive();
    if (root) {
      context.closeResults();
    }
  }

  /**
   * Force releases the operator after a failure escaped it, so that neither its consumer nor its
   * parent waits on it.
   */
  void release(ExecutionContext context) {
    stateLock.lock();
    try {
      state = OperatorState.PANICKED;
      stateChanged.signalAll();
    } finally {
      stateLock.unlock();
    }
    if (sendsSerialized) {
      try {
        ((BaseOperator) output).serializedClose(context);
      } catch (Throwable t) {
        log.warn("Error closing serialized consumer of {}", plan.describe(), t);
      }
    }
    try {
      notifyStop();
    } finally {
      notifyParent();
      exchange.close();
      releaseBatch();
      if (root) {
        context.closeResults();
      }
    }
  }

  @Override
  public void sendAction(OperatorAction action) {
    baseSendAction(action);
  }

  /**
   * Applies a stop or pause to this operator alone.
   *
   * @return true if the operator was running and has been told to stop
   */
  protected final boolean baseSendAction(OperatorAction action) {
    stateLock.lock();
    try {
      switch (state) {
        case CREATED -> {
          state = action == OperatorAction.PAUSE ? OperatorState.PAUSED : OperatorState.KILLED;
          stateChanged.signalAll();
          return false;
        }
        case PAUSED -> {
          if (action == OperatorAction.STOP) {
            state = OperatorState.KILLED;
            stateChanged.signalAll();
          }
          return false;
        }
        case RUNNING -> {
          state = OperatorState.STOPPING;
          exchange.sendStop();
          stateChanged.signalAll();
          return true;
        }
        default -> {
          return false;
        }
      }
    } finally {
      stateLock.unlock();
    }
  }

  /** Waits until the current activation has run to its end, or was stopped before it started. */
  protected void waitRunEnded() {
    stateLock.lock();
    try {
      while (state == OperatorState.CREATED
          || state == OperatorState.RUNNING
          || state == OperatorState.STOPPING) {
        stateChanged.awaitUninterruptibly();
      }
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public void done() {
    stateLock.lock();
    try {
      while (state == OperatorState.RUNNING || state == OperatorState.STOPPING) {
        stateChanged.awaitUninterruptibly();
      }
      switch (state) {
        case CREATED, PAUSED -> state = OperatorState.KILLED;
        case DORMANT, COMPLETED -> state = OperatorState.DONE;
        case STOPPED -> state = OperatorState.ENDED;
        default -> {}
      }
      stateChanged.signalAll();
    } finally {
      stateLock.unlock();
    }
    exchange.dispose();
    releaseBatch();
  }

  @Override
  public boolean reopen(ExecutionContext context) {
    stateLock.lock();
    try {
      while (state == OperatorState.RUNNING || state == OperatorState.STOPPING) {
        stateChanged.awaitUninterruptibly();
      }
      switch (state) {
        case STOPPED, DONE, ENDED, KILLED, PANICKED -> {
          return false;
        }
        default -> {}
      }
      state = OperatorState.CREATED;
      once.set(false);
      parentNotified.set(false);
      serialized = false;
      sendsSerialized = false;
      exchange.reset();
      releaseBatch();
      resetState();
      return true;
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public OperatorState getState() {
    stateLock.lock();
    try {
      return state;
    } finally {
      stateLock.unlock();
    }
  }

  // timing and profile

  /** Accrues the time since the last switch to the current phase and enters {@code next}. */
  protected void switchPhase(Phase next) {
    long now = System.nanoTime();
    long elapsed = now - phaseStart;
    ExecutionPhase executionPhase = executionPhase();
    switch (phase) {
      case EXEC -> {
        execTime.addAndGet(elapsed);
        if (executionPhase != null) {
          context.addPhaseTime(executionPhase, elapsed);
        }
      }
      case SERV -> {
        servTime.addAndGet(elapsed);
        if (executionPhase != null) {
          context.addPhaseTime(executionPhase, elapsed);
        }
      }
      case CHAN -> chanTime.addAndGet(elapsed);
      default -> {}
    }
    if (next != phase) {
      phaseSwitches.incrementAndGet();
    }
    phase = next;
    phaseStart = now;
  }

  protected void addInDocs(long count) {
    inDocs.addAndGet(count);
  }

  public long getExecTime() {
    return execTime.get();
  }

  public long getChanTime() {
    return chanTime.get();
  }

  public long getServTime() {
    return servTime.get();
  }

  public long getInDocs() {
    return inDocs.get();
  }

  public long getOutDocs() {
    return outDocs.get();
  }

  @Override
  public void accrueTimes(Operator copy) {
    BaseOperator other = (BaseOperator) copy;
    execTime.addAndGet(other.execTime.get());
    chanTime.addAndGet(other.chanTime.get());
    servTime.addAndGet(other.servTime.get());
    inDocs.addAndGet(other.inDocs.get());
    outDocs.addAndGet(other.outDocs.get());
    phaseSwitches.addAndGet(other.phaseSwitches.get());
  }

  @Override
  public Map<String, Object> profile() {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("#operator", plan.getOperatorType().getDisplayName());
    doc.put("#stats", stats());
    return doc;
  }

  private Map<String, Object> stats() {
    Map<String, Object> stats = new LinkedHashMap<>();
    stats.put("#itemsIn", inDocs.get());
    stats.put("#itemsOut", outDocs.get());
    stats.put("#phaseSwitches", phaseSwitches.get());
    stats.put("execTime", Operators.formatDuration(execTime.get()));
    stats.put("kernTime", Operators.formatDuration(chanTime.get()));
    stats.put("servTime", Operators.formatDuration(servTime.get()));
    stats.put("state", getState().name().toLowerCase(Locale.ROOT));
    if (exchange.getBeatYields() > 0) {
      stats.put("#heartbeatYields", exchange.getBeatYields());
    }
    long memory = usedMemory();
    if (memory > 0) {
      stats.put("usedMemory", memory);
    }
    if (exchange.getMemYields() > 0) {
      stats.put("#memYields", exchange.getMemYields());
    }
    return stats;
  }
}
