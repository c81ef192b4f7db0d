package org.streamc.simulator;

import org.streamc.simulator.values.IValue;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/** The environment of a monitor: the variables it observes and the handlers it calls. */
public class Host {
    /** One call of a handler. */
    public record Firing(long tick, String trigger, List<IValue> arguments) {}

    final Map<String, IValue> externals;
    final Map<String, Consumer<List<IValue>>> handlers;
    final List<Firing> firings;
    long tick;

    public Host() {
        this.externals = new LinkedHashMap<>();
        this.handlers = new HashMap<>();
        this.firings = new ArrayList<>();
        this.tick = 0;
    }

    public Host setExternal(String name, IValue value) {
        this.externals.put(name, value);
        return this;
    }

    @Nullable
    public IValue getExternal(String name) {
        return this.externals.get(name);
    }

    /** Register a callback invoked when the named trigger fires. */
    public Host onTrigger(String trigger, Consumer<List<IValue>> handler) {
        this.handlers.put(trigger, handler);
        return this;
    }

    void fire(String trigger, List<IValue> arguments) {
        this.firings.add(new Firing(this.tick, trigger, arguments));
        Consumer<List<IValue>> handler = this.handlers.get(trigger);
        if (handler != null)
            handler.accept(arguments);
    }

    void setTick(long tick) {
        this.tick = tick;
    }

    /** All handler calls so far, in order. */
    public List<Firing> getFirings() {
        return this.firings;
    }

    public List<Firing> getFirings(String trigger) {
        List<Firing> result = new ArrayList<>();
        for (Firing firing: this.firings)
            if (firing.trigger().equals(trigger))
                result.add(firing);
        return result;
    }
}
