/**
 * 命名策略注册表实现
 */
package xyz.firestige.retry.registry;
