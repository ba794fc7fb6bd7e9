package com.psrlang.compiler.classifier;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * 可识别的 DOM 事件名（小写）
 */
public final class DomEvents {

    private static final Set<String> EVENTS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            // 鼠标
            "click", "dblclick", "mousedown", "mouseup", "mousemove", "mouseenter", "mouseleave",
            "mouseover", "mouseout", "contextmenu", "auxclick",
            "pointerdown", "pointerup", "pointermove", "pointerenter", "pointerleave",
            "pointerover", "pointerout", "pointercancel",
            // 键盘
            "keydown", "keyup", "keypress",
            // 表单
            "input", "change", "submit", "reset", "invalid", "beforeinput",
            // 焦点
            "focus", "blur", "focusin", "focusout",
            // 拖放
            "drag", "dragstart", "dragend", "dragenter", "dragleave", "dragover", "drop",
            // 触摸
            "touchstart", "touchend", "touchmove", "touchcancel",
            // 滚动
            "scroll", "wheel",
            // 剪贴板
            "copy", "cut", "paste",
            // 媒体
            "play", "pause", "ended", "volumechange", "timeupdate", "seeking", "seeked",
            "loadeddata", "loadedmetadata", "canplay", "canplaythrough", "playing", "waiting",
            // 动画与过渡
            "animationstart", "animationend", "animationiteration",
            "transitionstart", "transitionend", "transitionrun", "transitioncancel",
            // 其他
            "load", "error", "abort", "resize", "select"
    )));

    private DomEvents() {
    }

    public static boolean isEvent(String name) {
        return EVENTS.contains(name);
    }

    /**
     * 事件属性：on 加大写字母开头，其余部分小写后是已知事件（onClick、onMouseEnter）
     */
    public static boolean isEventAttribute(String attribute) {
        if (attribute == null || attribute.length() < 3 || !attribute.startsWith("on")) {
            return false;
        }
        if (!Character.isUpperCase(attribute.charAt(2))) {
            return false;
        }
        return isEvent(eventName(attribute));
    }

    /** onClick -&gt; click */
    public static String eventName(String attribute) {
        return attribute.substring(2).toLowerCase();
    }
}
