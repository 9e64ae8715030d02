package com.typebridge.retarget;

import com.typebridge.expr.Var;
import com.typebridge.model.TypeDescriptor;

import java.util.HashMap;
import java.util.Map;

/**
 * 变量身份表：两个方向共享，保证来回改写同一变量得到同一个对象。
 * <p>
 * 正向改写一个 origin 变量时记住 forward[v]=v'、backward[v']=v；
 * 反向改写 v' 时直接取回 v。反向遇到不是正向产物的变量时每次都新建一个，
 * 并记 forward[新]=v'，之后正向改写它会回到 v'。
 * <p>
 * 以 stamp 为键，与 {@link Var} 的身份语义一致。
 */
public final class VariableIdentityTable {

    private final TypeUniverseResolver types;
    private final Map<Long, Var> forward = new HashMap<>();
    private final Map<Long, Var> backward = new HashMap<>();

    public VariableIdentityTable(TypeUniverseResolver types) {
        this.types = types;
    }

    public Var rewrite(Direction direction, Var var) {
        if (var.getType().isHostDefined()) {
            return var;
        }
        return direction.isForward() ? toTarget(var) : toOrigin(var);
    }

    private Var toTarget(Var var) {
        Var known = forward.get(var.getStamp());
        if (known != null) {
            return known;
        }
        Var rewritten = fresh(Direction.FORWARD, var);
        forward.put(var.getStamp(), rewritten);
        backward.put(rewritten.getStamp(), var);
        return rewritten;
    }

    private Var toOrigin(Var var) {
        Var known = backward.get(var.getStamp());
        if (known != null) {
            return known;
        }
        Var rewritten = fresh(Direction.BACKWARD, var);
        forward.put(rewritten.getStamp(), var);
        return rewritten;
    }

    private Var fresh(Direction direction, Var var) {
        TypeDescriptor type = types.resolve(direction, var.getType());
        return new Var(var.getName(), type, var.isMutable());
    }

    public boolean isKnown(Direction direction, Var var) {
        return (direction.isForward() ? forward : backward).containsKey(var.getStamp());
    }

    public int size() {
        return forward.size();
    }
}
