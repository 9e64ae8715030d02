package com.typebridge.retarget;

import com.typebridge.model.TypeDescriptor;
import com.typebridge.model.TypeUniverse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 目标宇宙中有多个互不相同的同名类型。
 */
public class AmbiguousTypeException extends RetargetException {

    private final TypeDescriptor type;
    private final TypeUniverse searched;
    private final List<TypeDescriptor> candidates;

    public AmbiguousTypeException(Direction direction, TypeDescriptor type, TypeUniverse searched,
                                  List<TypeDescriptor> candidates) {
        super(direction, message(direction, type, searched));
        this.type = type;
        this.searched = searched;
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
    }

    private static String message(Direction direction, TypeDescriptor type, TypeUniverse searched) {
        if (direction.isForward()) {
            return "The type '" + type + "' used by the provider was found in multiple modules of the target "
                    + "module set " + searched.describeModules() + ". You may need to adjust your module "
                    + "references to avoid ambiguities.";
        }
        return "The type '" + type + "' used by the provider was found in multiple modules of the provider's "
                + "own module set " + searched.describeModules() + ". "
                + "Please report this problem to the provider's maintainers.";
    }

    public TypeDescriptor getType() {
        return type;
    }

    public TypeUniverse getSearched() {
        return searched;
    }

    public List<TypeDescriptor> getCandidates() {
        return candidates;
    }
}
