package io.lighting.weave.render;

import io.lighting.weave.fragment.Fragment;
import io.lighting.weave.sql.RenderedSql;

/**
 * 片段渲染观察器。
 * <p>
 * 用于日志、指标等横切能力，回调均有默认空实现。回调在渲染线程上同步执行，
 * 实现类若持有状态需自行保证线程安全。
 */
public interface RenderObserver {
    /**
     * 渲染成功后回调。
     *
     * @param source       被渲染的片段
     * @param rendered     渲染结果
     * @param style        渲染结果使用的参数标记风格
     * @param elapsedNanos 渲染耗时（纳秒）
     */
    default void afterRender(Fragment source, RenderedSql rendered, PlaceholderStyle style, long elapsedNanos) {
    }

    /**
     * 渲染失败回调，异常随后仍会抛给调用方。回调自身抛出的异常作为被抑制异常附加到原始异常上。
     */
    default void onRenderError(Fragment source, RuntimeException error, long elapsedNanos) {
    }
}
