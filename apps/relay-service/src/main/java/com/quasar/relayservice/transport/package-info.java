/**
 * 通信协议适配层：连接句柄抽象与 JSON 线协议编解码。
 * 它是 WebSocket 传输与 relay 核心之间的桥梁层，
 * 只定义“服务器和客户端之间交换的消息结构”，不关心帧转发、slot、bridge 等业务。
 *
 * [浏览器 viewer / 游戏 source]  <---- WebSocket JSON {t: ...} ---->  [transport 层]
 *         ↓
 *         [protocol 路由层]
 *         ↓
 *         [frame / tick / slot / bridge]
 */
package com.quasar.relayservice.transport;
