package com.typebridge.retarget;

import com.typebridge.model.TypeDescriptor;
import com.typebridge.model.TypeUniverse;

/**
 * 目标宇宙中找不到同名类型。
 */
public class TypeNotFoundException extends RetargetException {

    private final TypeDescriptor type;
    private final TypeUniverse searched;

    public TypeNotFoundException(Direction direction, TypeDescriptor type, TypeUniverse searched) {
        super(direction, message(direction, type, searched));
        this.type = type;
        this.searched = searched;
    }

    private static String message(Direction direction, TypeDescriptor type, TypeUniverse searched) {
        if (direction.isForward()) {
            return "The type '" + type + "' used by the provider was not found in the target module set "
                    + searched.describeModules() + ". You may be referencing a reduced profile which contains "
                    + "fewer types than those needed by the provider you are using.";
        }
        return "The target type '" + type + "' used by the provider was not found in the origin module set "
                + searched.describeModules() + ". You may be referencing a reduced profile which contains "
                + "fewer types than those needed by the provider you are using. "
                + "Please report this problem to the provider's maintainers.";
    }

    public TypeDescriptor getType() {
        return type;
    }

    public TypeUniverse getSearched() {
        return searched;
    }
}
